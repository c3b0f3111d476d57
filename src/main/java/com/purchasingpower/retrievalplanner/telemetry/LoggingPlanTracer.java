package com.purchasingpower.retrievalplanner.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Tracer that writes events to the application log.
 * Failure events go out at WARN, everything else at DEBUG.
 */
@Slf4j
public class LoggingPlanTracer implements PlanTracer {

    @Override
    public void logEvent(String kind, Map<String, Object> payload) {
        if (kind != null && kind.endsWith("_failure")) {
            log.warn("[trace] {} {}", kind, TraceFormatter.formatMap(payload));
        } else {
            log.debug("[trace] {} {}", kind, TraceFormatter.formatMap(payload));
        }
    }
}
