package com.purchasingpower.retrievalplanner.learning;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only record of query times and query patterns.
 *
 * <p>Shared by the base optimizer, which adapts parameters from it, and the
 * learning loop, which feeds it. History is unbounded until {@link #reset()}.
 * All methods are synchronized.
 */
@Slf4j
public class QueryStatistics {

    private static final Duration DEFAULT_RECENT_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final List<Double> queryTimes = new ArrayList<>();
    private final List<Instant> queryTimestamps = new ArrayList<>();
    private final Map<QueryPattern, Integer> patternCounts = new LinkedHashMap<>();
    private double totalQueryTime;

    public QueryStatistics() {
        this(Clock.systemUTC());
    }

    public QueryStatistics(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param seconds execution time of one query, in seconds
     */
    public synchronized void recordQueryTime(double seconds) {
        queryTimes.add(seconds);
        queryTimestamps.add(clock.instant());
        totalQueryTime += seconds;
    }

    public synchronized void recordQueryPattern(QueryPattern pattern) {
        patternCounts.merge(pattern, 1, Integer::sum);
    }

    public synchronized int getQueryCount() {
        return queryTimes.size();
    }

    public synchronized double getAverageQueryTime() {
        return queryTimes.isEmpty() ? 0.0 : totalQueryTime / queryTimes.size();
    }

    /**
     * Most frequent patterns, most frequent first. Equal counts keep
     * first-seen order.
     */
    public synchronized List<Map.Entry<QueryPattern, Integer>> getCommonPatterns(int topN) {
        return patternCounts.entrySet().stream()
                .sorted(Map.Entry.<QueryPattern, Integer>comparingByValue().reversed())
                .limit(topN)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    public synchronized List<Double> getRecentQueryTimes(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<Double> recent = new ArrayList<>();
        for (int i = 0; i < queryTimestamps.size(); i++) {
            if (!queryTimestamps.get(i).isBefore(cutoff)) {
                recent.add(queryTimes.get(i));
            }
        }
        return recent;
    }

    /**
     * Least-squares slope of query time over query index, in seconds per query.
     * Positive means queries are getting slower. Zero with fewer than two queries.
     */
    public synchronized double getTimeTrend() {
        int n = queryTimes.size();
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = totalQueryTime / n;
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (queryTimes.get(i) - meanY);
            denominator += dx * dx;
        }
        return numerator / denominator;
    }

    public synchronized Map<String, Object> getPerformanceSummary() {
        List<Double> recent = getRecentQueryTimes(DEFAULT_RECENT_WINDOW);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("query_count", queryTimes.size());
        summary.put("avg_query_time", getAverageQueryTime());
        summary.put("min_query_time", queryTimes.stream().min(Comparator.naturalOrder()).orElse(0.0));
        summary.put("max_query_time", queryTimes.stream().max(Comparator.naturalOrder()).orElse(0.0));
        summary.put("recent_avg_time", recent.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        summary.put("time_trend", getTimeTrend());
        summary.put("common_patterns", getCommonPatterns(5));
        return summary;
    }

    public synchronized void reset() {
        queryTimes.clear();
        queryTimestamps.clear();
        patternCounts.clear();
        totalQueryTime = 0.0;
        log.debug("Query statistics reset");
    }
}
