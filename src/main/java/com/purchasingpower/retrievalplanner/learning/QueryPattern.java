package com.purchasingpower.retrievalplanner.learning;

import java.util.List;

/**
 * Parameter shape of a planned query, counted by {@link QueryStatistics}.
 *
 * @param maxTraversalDepth planned traversal depth
 * @param edgeTypes planned edge types, priority order
 * @param strategy strategy label, {@code null} when none was chosen
 */
public record QueryPattern(int maxTraversalDepth, List<String> edgeTypes, String strategy) {

    public QueryPattern {
        edgeTypes = edgeTypes != null ? List.copyOf(edgeTypes) : List.of();
    }
}
