package com.purchasingpower.retrievalplanner.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory resource ceilings for the executor. Times are in milliseconds.
 * The planner never enforces them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Budget {

    public static final String VECTOR_SEARCH_MS = "vector_search_ms";
    public static final String GRAPH_TRAVERSAL_MS = "graph_traversal_ms";
    public static final String RANKING_MS = "ranking_ms";
    public static final String TIMEOUT_MS = "timeout_ms";
    public static final String CATEGORY_TRAVERSAL_MS = "category_traversal_ms";
    public static final String TOPIC_EXPANSION_MS = "topic_expansion_ms";
    public static final String MAX_NODES = "max_nodes";
    public static final String MAX_EDGES = "max_edges";
    public static final String MAX_CATEGORIES = "max_categories";
    public static final String MAX_TOPICS = "max_topics";

    private long vectorSearchMs;
    private long graphTraversalMs;
    private long rankingMs;
    private long timeoutMs;
    private long categoryTraversalMs;
    private long topicExpansionMs;

    private int maxNodes;
    private int maxEdges;
    private int maxCategories;
    private int maxTopics;

    /**
     * Every allocation keyed by resource name, in declaration order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(VECTOR_SEARCH_MS, (double) vectorSearchMs);
        values.put(GRAPH_TRAVERSAL_MS, (double) graphTraversalMs);
        values.put(RANKING_MS, (double) rankingMs);
        values.put(TIMEOUT_MS, (double) timeoutMs);
        values.put(CATEGORY_TRAVERSAL_MS, (double) categoryTraversalMs);
        values.put(TOPIC_EXPANSION_MS, (double) topicExpansionMs);
        values.put(MAX_NODES, (double) maxNodes);
        values.put(MAX_EDGES, (double) maxEdges);
        values.put(MAX_CATEGORIES, (double) maxCategories);
        values.put(MAX_TOPICS, (double) maxTopics);
        return values;
    }
}
