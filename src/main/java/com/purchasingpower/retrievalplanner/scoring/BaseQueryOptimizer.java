package com.purchasingpower.retrievalplanner.scoring;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.learning.QueryPattern;
import com.purchasingpower.retrievalplanner.learning.QueryStatistics;
import com.purchasingpower.retrievalplanner.model.retrieval.PlanQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base vector/graph weighting with parameters adapted from past queries.
 *
 * <p>Once {@value #MIN_QUERIES_FOR_ADAPTATION} queries have been recorded:
 * slow queries (mean above 1s) shrink top-k by 2 down to 3, fast ones (mean
 * below 100ms) grow it by 2 up to 10, and the traversal depth follows the
 * most common depth among the top recorded patterns.
 */
@Slf4j
public class BaseQueryOptimizer {

    static final int MIN_QUERIES_FOR_ADAPTATION = 10;
    private static final double SLOW_QUERY_SECONDS = 1.0;
    private static final double FAST_QUERY_SECONDS = 0.1;
    private static final int MIN_TOP_K = 3;
    private static final int MAX_TOP_K = 10;
    private static final int TOP_K_STEP = 2;

    private final QueryStatistics statistics;
    private final double vectorWeight;
    private final double graphWeight;

    public BaseQueryOptimizer(QueryStatistics statistics, PlannerProperties properties) {
        this.statistics = statistics;
        this.vectorWeight = properties.getVectorWeight();
        this.graphWeight = properties.getGraphWeight();
    }

    public OptimizedParameters optimize(PlanQuery query, List<String> edgeTypes) {
        int topK = query.getMaxVectorResults();
        int depth = query.getMaxTraversalDepth();

        if (statistics.getQueryCount() >= MIN_QUERIES_FOR_ADAPTATION) {
            double avgTime = statistics.getAverageQueryTime();
            if (avgTime > SLOW_QUERY_SECONDS && topK > MIN_TOP_K) {
                topK = Math.max(MIN_TOP_K, topK - TOP_K_STEP);
            } else if (avgTime < FAST_QUERY_SECONDS && topK < MAX_TOP_K) {
                topK = Math.min(MAX_TOP_K, topK + TOP_K_STEP);
            }

            List<Map.Entry<QueryPattern, Integer>> common = statistics.getCommonPatterns(5);
            if (!common.isEmpty()) {
                depth = mostCommonDepth(common);
            }
            log.debug("Adapted parameters from {} queries (avg {}s): topK {} -> {}, depth {} -> {}",
                    statistics.getQueryCount(), avgTime, query.getMaxVectorResults(), topK,
                    query.getMaxTraversalDepth(), depth);
        }

        List<String> plannedEdgeTypes = List.copyOf(edgeTypes);
        statistics.recordQueryPattern(new QueryPattern(depth, plannedEdgeTypes, null));

        return OptimizedParameters.builder()
                .topK(topK)
                .maxTraversalDepth(depth)
                .edgeTypes(plannedEdgeTypes)
                .minSimilarity(query.getMinSimilarity())
                .vectorWeight(vectorWeight)
                .graphWeight(graphWeight)
                .build();
    }

    // Ties go to the depth of the higher-ranked pattern.
    private static int mostCommonDepth(List<Map.Entry<QueryPattern, Integer>> patterns) {
        Map<Integer, Integer> depthCounts = new LinkedHashMap<>();
        for (Map.Entry<QueryPattern, Integer> entry : patterns) {
            depthCounts.merge(entry.getKey().maxTraversalDepth(), 1, Integer::sum);
        }
        int best = patterns.get(0).getKey().maxTraversalDepth();
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : depthCounts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
