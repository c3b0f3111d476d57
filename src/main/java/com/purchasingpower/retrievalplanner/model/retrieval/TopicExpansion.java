package com.purchasingpower.retrievalplanner.model.retrieval;

/**
 * Topic added to a query by similarity search.
 *
 * @param topicId id of the topic hit
 * @param name display name, falls back to the id
 * @param similarity similarity to the query, at least the expansion threshold
 */
public record TopicExpansion(String topicId, String name, double similarity) {
}
