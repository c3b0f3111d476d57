package com.purchasingpower.retrievalplanner.telemetry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("In-Memory Metrics Collector Tests")
class InMemoryMetricsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final InMemoryMetricsCollector collector =
            new InMemoryMetricsCollector(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Tracking ids are unique and keep their parameters")
    void testStartTracking() {
        String first = collector.startTracking(Map.of("query_id", "q-1", "top_k", 5));
        String second = collector.startTracking(null);

        assertNotEquals(first, second);
        assertEquals(2, collector.size());
        TrackedQuery tracked = collector.getTracked(first).orElseThrow();
        assertEquals(NOW, tracked.getStartedAt());
        assertThat(tracked.getQueryParams()).containsEntry("top_k", 5);
        assertThat(collector.getTracked(second).orElseThrow().getQueryParams()).isEmpty();
    }

    @Test
    @DisplayName("Phases are recorded in order; unknown ids are ignored")
    void testRecordPhase() {
        String id = collector.startTracking(Map.of());

        collector.recordPhase(id, "base_weighting", Duration.ofMillis(3));
        collector.recordPhase(id, "expansion", Duration.ofMillis(12));
        collector.recordPhase("missing", "expansion", Duration.ofMillis(1));

        assertThat(collector.getTracked(id).orElseThrow().getPhases().keySet())
                .containsExactly("base_weighting", "expansion");
        assertTrue(collector.getTracked("missing").isEmpty());
    }

    @Test
    @DisplayName("Only the most recent entries are kept once the history is full")
    void testStartTracking_EvictsOldest() {
        // Given
        InMemoryMetricsCollector bounded = new InMemoryMetricsCollector(Clock.fixed(NOW, ZoneOffset.UTC), 3);
        List<String> ids = new ArrayList<>();

        // When
        for (int i = 0; i < 10_000; i++) {
            ids.add(bounded.startTracking(Map.of("query_id", "q-" + i)));
        }

        // Then
        assertEquals(3, bounded.size());
        assertTrue(bounded.getTracked(ids.get(0)).isEmpty());
        assertTrue(bounded.getTracked(ids.get(9_996)).isEmpty());
        assertThat(bounded.getTracked(ids.get(9_999)).orElseThrow().getQueryParams())
                .containsEntry("query_id", "q-9999");
        assertTrue(bounded.getTracked(ids.get(9_997)).isPresent());
    }

    @Test
    @DisplayName("A non-positive history size is rejected")
    void testConstructor_RejectsEmptyHistory() {
        assertThrows(IllegalArgumentException.class,
                () -> new InMemoryMetricsCollector(Clock.fixed(NOW, ZoneOffset.UTC), 0));
    }
}
