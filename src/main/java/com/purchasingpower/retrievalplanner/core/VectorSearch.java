package com.purchasingpower.retrievalplanner.core;

import java.util.List;
import java.util.function.Predicate;

/**
 * Vector-similarity search capability supplied by the caller.
 * The planner only uses it for topic expansion.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface VectorSearch {

    /**
     * @param vector query embedding
     * @param topK maximum number of hits to return
     * @param filter predicate a hit must satisfy, never {@code null}
     * @return hits ordered by descending score
     */
    List<SearchHit> search(double[] vector, int topK, Predicate<SearchHit> filter);
}
