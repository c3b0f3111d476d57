package com.purchasingpower.retrievalplanner.telemetry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Metrics sink that correlates a plan with its later execution.
 *
 * @since 1.0.0
 */
public interface MetricsCollector {

    /**
     * Starts tracking a query.
     *
     * @param queryParams parameters describing the query
     * @return tracking id, used as the plan id
     */
    String startTracking(Map<String, Object> queryParams);

    /**
     * Records the duration of a named planning phase.
     */
    void recordPhase(String trackingId, String phase, Duration duration);

    /**
     * Snapshot of what has been recorded for a tracking id.
     */
    Optional<TrackedQuery> getTracked(String trackingId);
}
