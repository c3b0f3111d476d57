package com.purchasingpower.retrievalplanner.telemetry;

import java.util.Map;

/**
 * Formatting helpers that keep trace lines short.
 */
public final class TraceFormatter {

    private TraceFormatter() {
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Format a payload map; large maps collapse to their entry count.
     */
    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() <= 8) {
            return truncate(map.toString(), 500);
        }
        return "{" + map.size() + " entries}";
    }
}
