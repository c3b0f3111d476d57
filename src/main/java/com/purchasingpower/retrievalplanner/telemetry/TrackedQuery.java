package com.purchasingpower.retrievalplanner.telemetry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of one tracked query.
 */
@Value
@Builder
public class TrackedQuery {
    String trackingId;
    Instant startedAt;
    Map<String, Object> queryParams;
    Map<String, Duration> phases;
}
