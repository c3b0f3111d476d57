package com.purchasingpower.retrievalplanner.telemetry;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Measures consecutive planning phases.
 *
 * <p>Each {@link #mark(String)} closes the phase that started at the previous
 * mark (or at construction).
 */
public class PhaseTimer {

    private final Map<String, Duration> phases = new LinkedHashMap<>();
    private Instant phaseStart = Instant.now();

    public void mark(String phase) {
        Instant now = Instant.now();
        phases.put(phase, Duration.between(phaseStart, now));
        phaseStart = now;
    }

    public Map<String, Duration> getPhases() {
        return phases;
    }

    public long totalMillis() {
        return phases.values().stream().mapToLong(Duration::toMillis).sum();
    }
}
