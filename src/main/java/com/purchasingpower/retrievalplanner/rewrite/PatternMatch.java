package com.purchasingpower.retrievalplanner.rewrite;

import java.util.List;

/**
 * Detected query intent and the entities it names.
 *
 * @param kind matched template
 * @param entities extracted entities; two for comparisons, one otherwise
 */
public record PatternMatch(PatternKind kind, List<String> entities) {

    public PatternMatch {
        entities = List.copyOf(entities);
    }
}
