package com.purchasingpower.retrievalplanner.telemetry;

import java.util.Map;

/**
 * Sink for planner trace events. Recoverable failures are reported here so
 * they are observable even though they never abort planning.
 *
 * @since 1.0.0
 */
public interface PlanTracer {

    String EXPANSION_FAILURE = "expansion_failure";
    String GRAPH_ACCESS_FAILURE = "graph_access_failure";
    String REWRITE_FAILURE = "rewrite_failure";
    String QUERY_EXPANSION = "query_expansion";
    String PATTERN_DETECTED = "pattern_detected";
    String PLAN_CREATED = "plan_created";
    String WEIGHTS_ADJUSTED = "weights_adjusted";

    void logEvent(String kind, Map<String, Object> payload);
}
