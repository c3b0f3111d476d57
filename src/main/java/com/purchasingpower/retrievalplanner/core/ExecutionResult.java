package com.purchasingpower.retrievalplanner.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A result reported back by the external executor, used for early-stopping
 * decisions and for weight learning.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ExecutionResult {

    String id;

    /**
     * Relevance score in [0, 1], {@code null} when the executor did not score it.
     */
    Double score;

    /**
     * Result type, e.g. "category", "article".
     */
    String type;

    /**
     * Category the result belongs to, if any.
     */
    String category;

    /**
     * Edge types walked on the path that produced this result, in order.
     */
    @Singular("pathEdge")
    List<String> pathEdgeTypes;

    public boolean hasScore() {
        return score != null;
    }
}
