package com.purchasingpower.retrievalplanner.model.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named traversal strategy handed to the executor.
 *
 * <p>The base strategy comes from the graph type; a detected query pattern
 * replaces it with a pattern-specific one.
 */
public enum TraversalStrategy {
    HIERARCHICAL,
    STANDARD,
    TOPIC_FOCUSED,
    COMPARISON,
    DEFINITION,
    CAUSAL,
    COLLECTION,
    /**
     * No graph data: the executor runs the vector search only.
     */
    VECTOR_ONLY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
