package com.purchasingpower.retrievalplanner.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schedule for the graph walk: which edge types to follow, how deep each one
 * stays active, how many nodes each level may visit and what each edge costs.
 *
 * Example for {@code [subclass_of, related_to, mentions]}, depth 2, 100 nodes:
 * <pre>
 *   edgeTypes:      [subclass_of, related_to, mentions]
 *   levelBudgets:   [40, 14]
 *   activeDepths:   {subclass_of=2, related_to=1, mentions=1}
 *   traversalCosts: {subclass_of=0.6, related_to=1.0, mentions=1.5}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalPlan {

    /**
     * Edge types, highest priority first.
     */
    @Builder.Default
    private List<String> edgeTypes = new ArrayList<>();

    /**
     * Node budget per level; length equals maxDepth, never increasing.
     */
    @Builder.Default
    private List<Integer> levelBudgets = new ArrayList<>();

    /**
     * Deepest level at which each edge type is still followed.
     */
    @Builder.Default
    private Map<String, Integer> activeDepths = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> traversalCosts = new LinkedHashMap<>();

    private int maxDepth;

    /**
     * Boost the executor applies to hierarchical edges.
     */
    private double hierarchicalWeight;

    public static TraversalPlan empty() {
        return TraversalPlan.builder().build();
    }

    public boolean isEmpty() {
        return edgeTypes.isEmpty();
    }

    public int totalLevelBudget() {
        return levelBudgets.stream().mapToInt(Integer::intValue).sum();
    }
}
