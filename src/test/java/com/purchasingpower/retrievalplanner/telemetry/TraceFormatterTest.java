package com.purchasingpower.retrievalplanner.telemetry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Trace Formatter Tests")
class TraceFormatterTest {

    @Test
    @DisplayName("Long text is cut and annotated")
    void testTruncate() {
        assertEquals("abc", TraceFormatter.truncate("abc", 5));
        assertEquals("abcde... [+3 chars]", TraceFormatter.truncate("abcdefgh", 5));
        assertEquals("(null)", TraceFormatter.truncate(null, 5));
    }

    @Test
    @DisplayName("Large payloads collapse to their size")
    void testFormatMap() {
        Map<String, Object> large = new HashMap<>();
        for (int i = 0; i < 9; i++) {
            large.put("k" + i, i);
        }

        assertEquals("{}", TraceFormatter.formatMap(null));
        assertEquals("{9 entries}", TraceFormatter.formatMap(large));
        assertTrue(TraceFormatter.formatMap(Map.of("pattern", "definition")).contains("definition"));
    }
}
