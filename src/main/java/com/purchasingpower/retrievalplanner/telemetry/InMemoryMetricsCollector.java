package com.purchasingpower.retrievalplanner.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local metrics collector. Keeps the most recent {@code maxHistory}
 * tracked queries in memory; older entries are evicted first.
 */
@Slf4j
public class InMemoryMetricsCollector implements MetricsCollector {

    public static final int DEFAULT_MAX_HISTORY = 1000;

    private final Clock clock;
    private final int maxHistory;
    private final ConcurrentHashMap<String, Entry> tracked = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();

    public InMemoryMetricsCollector() {
        this(Clock.systemUTC());
    }

    public InMemoryMetricsCollector(Clock clock) {
        this(clock, DEFAULT_MAX_HISTORY);
    }

    public InMemoryMetricsCollector(Clock clock, int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive, was " + maxHistory);
        }
        this.clock = clock;
        this.maxHistory = maxHistory;
    }

    @Override
    public String startTracking(Map<String, Object> queryParams) {
        String trackingId = UUID.randomUUID().toString();
        Map<String, Object> params = queryParams != null ? new LinkedHashMap<>(queryParams) : new LinkedHashMap<>();
        tracked.put(trackingId, new Entry(clock.instant(), params));
        insertionOrder.add(trackingId);
        evictOldest();
        log.debug("Tracking query {} ({} params)", trackingId, params.size());
        return trackingId;
    }

    @Override
    public void recordPhase(String trackingId, String phase, Duration duration) {
        Entry entry = tracked.get(trackingId);
        if (entry == null) {
            log.debug("Ignoring phase '{}' for unknown tracking id {}", phase, trackingId);
            return;
        }
        synchronized (entry) {
            entry.phases.put(phase, duration);
        }
    }

    @Override
    public Optional<TrackedQuery> getTracked(String trackingId) {
        Entry entry = tracked.get(trackingId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.of(TrackedQuery.builder()
                    .trackingId(trackingId)
                    .startedAt(entry.startedAt)
                    .queryParams(Collections.unmodifiableMap(new LinkedHashMap<>(entry.params)))
                    .phases(new LinkedHashMap<>(entry.phases))
                    .build());
        }
    }

    public int size() {
        return tracked.size();
    }

    private void evictOldest() {
        while (tracked.size() > maxHistory) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            tracked.remove(oldest);
        }
    }

    private static final class Entry {
        private final Instant startedAt;
        private final Map<String, Object> params;
        private final Map<String, Duration> phases = new LinkedHashMap<>();

        private Entry(Instant startedAt, Map<String, Object> params) {
            this.startedAt = startedAt;
            this.params = params;
        }
    }
}
