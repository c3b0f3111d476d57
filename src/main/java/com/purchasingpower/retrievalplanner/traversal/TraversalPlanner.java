package com.purchasingpower.retrievalplanner.traversal;

import com.purchasingpower.retrievalplanner.knowledge.RelationshipWeightTable;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns edge-type priorities into a depth and node-budget schedule.
 *
 * <p>Level 0 receives 40% of the node budget, level {@code d > 0} receives
 * {@code 20% * 0.7^d}, each clipped to what is left. Higher-priority edge
 * types stay active deeper: rank {@code i} of {@code n} is followed up to
 * {@code round((1 - i/(n-1)) * maxDepth)} levels, never fewer than one.
 */
@Slf4j
@RequiredArgsConstructor
public class TraversalPlanner {

    static final double FIRST_LEVEL_SHARE = 0.4;
    static final double LEVEL_SHARE = 0.2;
    static final double LEVEL_DECAY = 0.7;

    static final Map<String, Double> TRAVERSAL_COSTS;
    static final double DEFAULT_TRAVERSAL_COST = 1.0;

    static {
        Map<String, Double> costs = new LinkedHashMap<>();
        costs.put("subclass_of", 0.6);
        costs.put("instance_of", 0.6);
        costs.put("part_of", 0.7);
        costs.put("has_part", 0.7);
        costs.put("category_contains", 0.7);
        costs.put("in_category", 0.7);
        costs.put("related_to", 1.0);
        costs.put("similar_to", 1.0);
        costs.put("refers_to", 1.1);
        costs.put("created_by", 1.2);
        costs.put("authored_by", 1.2);
        costs.put("developed_by", 1.2);
        costs.put("mentions", 1.5);
        costs.put("mentioned_in", 1.5);
        TRAVERSAL_COSTS = Collections.unmodifiableMap(costs);
    }

    private final RelationshipWeightTable weightTable;
    private final double hierarchicalWeight;

    public TraversalPlan plan(List<String> edgeTypes, int maxDepth, int totalNodeBudget) {
        return plan(edgeTypes, maxDepth, totalNodeBudget, List.of());
    }

    /**
     * @param preferredEdgeTypes types to move to the front of the priority
     *                           order; types not in {@code edgeTypes} are ignored
     */
    public TraversalPlan plan(List<String> edgeTypes, int maxDepth, int totalNodeBudget,
                              List<String> preferredEdgeTypes) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        if (totalNodeBudget < 0) {
            throw new IllegalArgumentException("totalNodeBudget must not be negative: " + totalNodeBudget);
        }
        if (edgeTypes == null || edgeTypes.isEmpty()) {
            log.debug("No edge types to plan, returning empty traversal plan");
            return TraversalPlan.empty();
        }

        List<String> prioritized = prioritize(new ArrayList<>(new LinkedHashSet<>(edgeTypes)), preferredEdgeTypes);
        List<Integer> levelBudgets = levelBudgets(maxDepth, totalNodeBudget);

        Map<String, Integer> activeDepths = new LinkedHashMap<>();
        Map<String, Double> traversalCosts = new LinkedHashMap<>();
        int n = prioritized.size();
        for (int i = 0; i < n; i++) {
            String edgeType = prioritized.get(i);
            activeDepths.put(edgeType, activeDepth(i, n, maxDepth));
            traversalCosts.put(edgeType, traversalCost(edgeType));
        }

        log.debug("Planned traversal over {} edge types, depth {}, level budgets {}",
                n, maxDepth, levelBudgets);

        return TraversalPlan.builder()
                .edgeTypes(prioritized)
                .levelBudgets(levelBudgets)
                .activeDepths(activeDepths)
                .traversalCosts(traversalCosts)
                .maxDepth(maxDepth)
                .hierarchicalWeight(hierarchicalWeight)
                .build();
    }

    private List<String> prioritize(List<String> edgeTypes, List<String> preferredEdgeTypes) {
        if (preferredEdgeTypes == null || preferredEdgeTypes.isEmpty()) {
            return weightTable.prioritize(edgeTypes);
        }
        Set<String> preferred = new LinkedHashSet<>();
        for (String type : preferredEdgeTypes) {
            preferred.add(RelationshipWeightTable.normalize(type));
        }

        List<String> first = new ArrayList<>();
        List<String> rest = new ArrayList<>();
        for (String type : edgeTypes) {
            if (preferred.contains(RelationshipWeightTable.normalize(type))) {
                first.add(type);
            } else {
                rest.add(type);
            }
        }
        List<String> ordered = new ArrayList<>(weightTable.prioritize(first));
        ordered.addAll(weightTable.prioritize(rest));
        return ordered;
    }

    static List<Integer> levelBudgets(int maxDepth, int totalNodeBudget) {
        List<Integer> budgets = new ArrayList<>(maxDepth);
        int remaining = totalNodeBudget;
        for (int level = 0; level < maxDepth; level++) {
            int share = level == 0
                    ? (int) (totalNodeBudget * FIRST_LEVEL_SHARE)
                    : (int) (totalNodeBudget * LEVEL_SHARE * Math.pow(LEVEL_DECAY, level));
            int budget = Math.min(remaining, share);
            budgets.add(budget);
            remaining -= budget;
        }
        return budgets;
    }

    static int activeDepth(int rank, int count, int maxDepth) {
        if (count == 1) {
            return maxDepth;
        }
        double relativeRank = (double) rank / (count - 1);
        int depth = Math.max(1, (int) Math.round((1.0 - relativeRank) * maxDepth));
        return Math.min(depth, maxDepth);
    }

    public static double traversalCost(String edgeType) {
        return TRAVERSAL_COSTS.getOrDefault(RelationshipWeightTable.normalize(edgeType), DEFAULT_TRAVERSAL_COST);
    }
}
