package com.purchasingpower.retrievalplanner.model.retrieval;

/**
 * Category added to a query by lexical overlap or hierarchy proximity.
 *
 * @param category category name
 * @param depth depth of the category in the hierarchy
 */
public record CategoryExpansion(String category, int depth) {
}
