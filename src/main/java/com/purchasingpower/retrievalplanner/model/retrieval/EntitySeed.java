package com.purchasingpower.retrievalplanner.model.retrieval;

/**
 * Entity suggested as a traversal starting point.
 *
 * @param entityId entity identifier
 * @param importance importance score in [0, 1]
 */
public record EntitySeed(String entityId, double importance) {
}
