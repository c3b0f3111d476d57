package com.purchasingpower.retrievalplanner.budget;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.core.ExecutionResult;
import com.purchasingpower.retrievalplanner.core.Priority;
import com.purchasingpower.retrievalplanner.knowledge.RelationshipWeightTable;
import com.purchasingpower.retrievalplanner.model.retrieval.Budget;
import com.purchasingpower.retrievalplanner.model.retrieval.ExecutionPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalHints;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partitions the resource budget of a plan and decides early stopping.
 *
 * <p>Allocation order: configured defaults, times complexity and priority
 * multipliers, raised to the historical floor, then category focus, topic
 * expansion factor and strategy bonuses. The historical floor is
 * {@code (mean + p95) / 2} of reported consumption; it only ever raises an
 * allocation, so budgets never shrink as priority rises.
 *
 * <p>Plans without graph traversal get a vector-only budget with every graph
 * and category field set to zero.
 */
@Slf4j
public class BudgetAllocator {

    private static final Set<String> CATEGORY_EDGE_TYPES = Set.of("category_contains", "in_category");

    private static final double HIERARCHICAL_BONUS = 1.3;
    private static final double TOPIC_FOCUSED_BONUS = 1.4;
    private static final double COMPARISON_BONUS = 1.2;

    private final PlannerProperties.Budget defaults;
    private final EarlyStoppingHeuristic baseHeuristic;
    private final Map<String, Deque<Double>> history = new LinkedHashMap<>();

    public BudgetAllocator(PlannerProperties properties) {
        this(properties, new ScoreDropEarlyStopping());
    }

    public BudgetAllocator(PlannerProperties properties, EarlyStoppingHeuristic baseHeuristic) {
        properties.validate();
        this.defaults = properties.getBudget();
        this.baseHeuristic = baseHeuristic;
    }

    public Budget allocate(ExecutionPlan plan, Priority priority) {
        TraversalPlan traversal = plan.getTraversal() != null ? plan.getTraversal() : TraversalPlan.empty();
        TraversalHints hints = plan.getHints() != null ? plan.getHints() : TraversalHints.builder().build();
        int topK = plan.getVectorParams() != null ? plan.getVectorParams().getTopK() : 0;

        QueryComplexity complexity = QueryComplexity.estimate(
                topK, traversal.getMaxDepth(), traversal.getEdgeTypes().size());
        double priorityMultiplier = defaults.multiplier(Objects.requireNonNullElse(priority, Priority.NORMAL).label());
        double scale = complexity.getMultiplier() * priorityMultiplier;

        Map<String, Double> values = defaultValues();
        values.replaceAll((resource, value) -> value * scale);
        applyHistoricalFloor(values);

        if (traversal.getEdgeTypes().stream()
                .map(RelationshipWeightTable::normalize)
                .anyMatch(CATEGORY_EDGE_TYPES::contains)) {
            multiply(values, defaults.getCategoryFocus(), Budget.CATEGORY_TRAVERSAL_MS, Budget.MAX_CATEGORIES);
        }

        if (hints.isExpandTopics()) {
            multiply(values, Math.max(0.0, hints.getTopicExpansionFactor()), Budget.TOPIC_EXPANSION_MS, Budget.MAX_TOPICS);
        }

        TraversalStrategy strategy = hints.getStrategy();
        if (strategy == TraversalStrategy.HIERARCHICAL) {
            multiply(values, HIERARCHICAL_BONUS, Budget.GRAPH_TRAVERSAL_MS, Budget.MAX_NODES);
        } else if (strategy == TraversalStrategy.TOPIC_FOCUSED) {
            multiply(values, TOPIC_FOCUSED_BONUS, Budget.VECTOR_SEARCH_MS);
        } else if (strategy == TraversalStrategy.COMPARISON) {
            multiply(values, COMPARISON_BONUS, Budget.VECTOR_SEARCH_MS, Budget.GRAPH_TRAVERSAL_MS);
        }

        if (traversal.isEmpty()) {
            for (String resource : List.of(Budget.GRAPH_TRAVERSAL_MS, Budget.CATEGORY_TRAVERSAL_MS,
                    Budget.MAX_NODES, Budget.MAX_EDGES, Budget.MAX_CATEGORIES)) {
                values.put(resource, 0.0);
            }
        }

        Budget budget = toBudget(values);
        log.debug("Allocated budget (complexity={}, priority={}, strategy={}): {}",
                complexity, priority, strategy, budget);
        return budget;
    }

    /**
     * Whether the executor can stop before exhausting its budget.
     *
     * @param results results so far, best first
     * @param budgetConsumedRatio fraction of the budget already used
     */
    public boolean shouldStopEarly(List<ExecutionResult> results, double budgetConsumedRatio) {
        if (results == null || results.isEmpty()) {
            return false;
        }

        long confidentCategories = results.stream()
                .filter(r -> "category".equals(r.getType()))
                .filter(r -> r.hasScore() && r.getScore() > 0.85)
                .count();
        if (confidentCategories >= 3 && budgetConsumedRatio >= 0.6) {
            log.debug("Early stop: {} high-confidence category results at {} consumed",
                    confidentCategories, budgetConsumedRatio);
            return true;
        }

        if (results.size() > 10) {
            Set<String> uniqueCategories = new HashSet<>();
            for (ExecutionResult result : results) {
                if (result.getCategory() != null && !result.getCategory().isEmpty()) {
                    uniqueCategories.add(result.getCategory());
                }
            }
            if (uniqueCategories.size() < results.size() * 0.3 && budgetConsumedRatio >= 0.7) {
                log.debug("Early stop: {} unique categories over {} results", uniqueCategories.size(), results.size());
                return true;
            }
        }

        return baseHeuristic.shouldStop(results, budgetConsumedRatio);
    }

    /**
     * Records what an executor actually consumed. Unknown resource names are
     * ignored; only the most recent {@code history-size} entries are kept.
     */
    public synchronized void recordConsumption(Map<String, Double> consumed) {
        Set<String> known = defaultValues().keySet();
        consumed.forEach((resource, amount) -> {
            if (!known.contains(resource) || amount == null) {
                log.debug("Ignoring consumption for unknown resource '{}'", resource);
                return;
            }
            Deque<Double> entries = history.computeIfAbsent(resource, k -> new ArrayDeque<>());
            entries.addLast(amount);
            while (entries.size() > defaults.getHistorySize()) {
                entries.removeFirst();
            }
        });
    }

    public ConsumptionReport consumptionReport(Budget budget, Map<String, Double> consumed) {
        Map<String, Double> allocated = budget.asMap();
        Map<String, Double> ratios = new LinkedHashMap<>();
        consumed.forEach((resource, amount) -> {
            Double limit = allocated.get(resource);
            if (limit == null || amount == null) {
                return;
            }
            ratios.put(resource, limit > 0 ? amount / limit : 0.0);
        });
        double overall = ratios.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return ConsumptionReport.builder()
                .ratios(ratios)
                .overallRatio(overall)
                .build();
    }

    private synchronized void applyHistoricalFloor(Map<String, Double> values) {
        history.forEach((resource, entries) -> {
            if (entries.isEmpty()) {
                return;
            }
            List<Double> sorted = new ArrayList<>(entries);
            sorted.sort(Double::compareTo);
            double mean = sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            int p95Index = Math.min((int) (sorted.size() * 0.95), sorted.size() - 1);
            double floor = (mean + sorted.get(p95Index)) / 2;
            values.computeIfPresent(resource, (k, value) -> Math.max(value, floor));
        });
    }

    private static void multiply(Map<String, Double> values, double factor, String... resources) {
        for (String resource : resources) {
            values.computeIfPresent(resource, (k, value) -> value * factor);
        }
    }

    private Map<String, Double> defaultValues() {
        Budget base = Budget.builder()
                .vectorSearchMs(defaults.getVectorSearchMs())
                .graphTraversalMs(defaults.getGraphTraversalMs())
                .rankingMs(defaults.getRankingMs())
                .timeoutMs(defaults.getTimeoutMs())
                .categoryTraversalMs(defaults.getCategoryTraversalMs())
                .topicExpansionMs(defaults.getTopicExpansionMs())
                .maxNodes(defaults.getMaxNodes())
                .maxEdges(defaults.getMaxEdges())
                .maxCategories(defaults.getMaxCategories())
                .maxTopics(defaults.getMaxTopics())
                .build();
        return base.asMap();
    }

    private static Budget toBudget(Map<String, Double> values) {
        return Budget.builder()
                .vectorSearchMs(Math.round(values.get(Budget.VECTOR_SEARCH_MS)))
                .graphTraversalMs(Math.round(values.get(Budget.GRAPH_TRAVERSAL_MS)))
                .rankingMs(Math.round(values.get(Budget.RANKING_MS)))
                .timeoutMs(Math.round(values.get(Budget.TIMEOUT_MS)))
                .categoryTraversalMs(Math.round(values.get(Budget.CATEGORY_TRAVERSAL_MS)))
                .topicExpansionMs(Math.round(values.get(Budget.TOPIC_EXPANSION_MS)))
                .maxNodes((int) Math.round(values.get(Budget.MAX_NODES)))
                .maxEdges((int) Math.round(values.get(Budget.MAX_EDGES)))
                .maxCategories((int) Math.round(values.get(Budget.MAX_CATEGORIES)))
                .maxTopics((int) Math.round(values.get(Budget.MAX_TOPICS)))
                .build();
    }
}
