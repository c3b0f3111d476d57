package com.purchasingpower.retrievalplanner.configuration;

import com.purchasingpower.retrievalplanner.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the retrieval query planner.
 *
 * <p>Properties are loaded from the {@code app.planner} namespace in
 * application.yml. Example configuration:
 * <pre>
 * app:
 *   planner:
 *     default-edge-weight: 0.5
 *     edge-weights:
 *       "[authored_by]": 0.9
 *     expansion:
 *       similarity-threshold: 0.65
 *       max-expansions: 5
 *     budget:
 *       max-nodes: 1000
 *       priority-multipliers:
 *         low: 0.5
 *         normal: 1.0
 *         high: 1.5
 * </pre>
 *
 * <p>Every field carries a default, so {@code new PlannerProperties()} is a
 * valid configuration for library use outside a Spring context.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.planner")
public class PlannerProperties {

    public static final double MIN_EDGE_WEIGHT = 0.1;
    public static final double MAX_EDGE_WEIGHT = 2.0;

    /**
     * Weight returned for edge types that have no explicit entry.
     */
    @DecimalMin("0.1")
    @DecimalMax("2.0")
    private double defaultEdgeWeight = 0.5;

    /**
     * Overrides merged over the built-in relationship weight table.
     */
    private Map<String, Double> edgeWeights = new LinkedHashMap<>();

    /**
     * Edge types planned when neither the query nor the graph names any.
     */
    private List<String> defaultEdgeTypes = new ArrayList<>(List.of(
            "subclass_of", "instance_of", "part_of", "related_to",
            "mentions", "category_contains", "similar_to"));

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double vectorWeight = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double graphWeight = 0.3;

    /**
     * Extra score weight for hierarchical edges relative to flat links.
     */
    @DecimalMin("0.0")
    private double hierarchicalBonus = 0.2;

    /**
     * Traversal boost multiplier handed to the executor for hierarchical edges.
     */
    @DecimalMin("0.0")
    private double hierarchicalWeight = 1.5;

    /**
     * Whether plans are registered with the metrics collector.
     */
    private boolean metricsEnabled = true;

    /**
     * Number of tracked plans the in-memory metrics collector keeps.
     */
    @Min(1)
    private int metricsMaxHistory = 1000;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Expansion expansion = new Expansion();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Budget budget = new Budget();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Learning learning = new Learning();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Entities entities = new Entities();

    /**
     * Checks the constraints that bean validation cannot express and that
     * must also hold when the properties are built by hand.
     *
     * @throws ConfigurationException on the first violated constraint
     */
    public void validate() {
        requireWeight("default-edge-weight", defaultEdgeWeight);
        if (edgeWeights != null) {
            edgeWeights.forEach((type, weight) -> {
                if (type == null || type.isBlank()) {
                    throw new ConfigurationException("edge-weights", "edge type must not be blank");
                }
                if (weight == null) {
                    throw new ConfigurationException("edge-weights." + type, "weight must not be null");
                }
                requireWeight("edge-weights." + type, weight);
            });
        }
        requireUnitInterval("vector-weight", vectorWeight);
        requireUnitInterval("graph-weight", graphWeight);
        if (hierarchicalBonus < 0 || hierarchicalWeight < 0) {
            throw new ConfigurationException("hierarchical-bonus", "hierarchical factors must not be negative");
        }
        if (metricsMaxHistory < 1) {
            throw new ConfigurationException("metrics-max-history", "must be positive");
        }
        expansion.validate();
        budget.validate();
        learning.validate();
        entities.validate();
    }

    private static void requireWeight(String property, double weight) {
        if (Double.isNaN(weight) || weight < MIN_EDGE_WEIGHT || weight > MAX_EDGE_WEIGHT) {
            throw new ConfigurationException(property,
                    "weight " + weight + " outside [" + MIN_EDGE_WEIGHT + ", " + MAX_EDGE_WEIGHT + "]");
        }
    }

    private static void requireUnitInterval(String property, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(property, "value " + value + " outside [0, 1]");
        }
    }

    /**
     * Query expansion settings.
     */
    @Data
    public static class Expansion {

        /**
         * Minimum similarity for a topic to be added to the query.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.65;

        /**
         * Upper bound on topics and on categories added to a query.
         */
        @Min(0)
        private int maxExpansions = 5;

        void validate() {
            requireUnitInterval("expansion.similarity-threshold", similarityThreshold);
            if (maxExpansions < 0) {
                throw new ConfigurationException("expansion.max-expansions", "must not be negative");
            }
        }
    }

    /**
     * Default resource allocations before priority, complexity and strategy
     * multipliers are applied.
     */
    @Data
    public static class Budget {

        @Min(0)
        private long vectorSearchMs = 500;

        @Min(0)
        private long graphTraversalMs = 1000;

        @Min(0)
        private long rankingMs = 200;

        @Min(0)
        private long timeoutMs = 2000;

        @Min(0)
        private long categoryTraversalMs = 5000;

        @Min(0)
        private long topicExpansionMs = 3000;

        @Min(0)
        private int maxNodes = 1000;

        @Min(0)
        private int maxEdges = 5000;

        @Min(0)
        private int maxCategories = 20;

        @Min(0)
        private int maxTopics = 15;

        /**
         * Multiplier applied to category fields when the plan walks
         * category-containment edges.
         */
        @DecimalMin("1.0")
        private double categoryFocus = 1.5;

        /**
         * Reported consumption entries kept per resource.
         */
        @Min(1)
        private int historySize = 100;

        private Map<String, Double> priorityMultipliers = new LinkedHashMap<>(Map.of(
                "low", 0.5,
                "normal", 1.0,
                "high", 1.5));

        void validate() {
            if (vectorSearchMs < 0 || graphTraversalMs < 0 || rankingMs < 0 || timeoutMs < 0
                    || categoryTraversalMs < 0 || topicExpansionMs < 0) {
                throw new ConfigurationException("budget", "time budgets must not be negative");
            }
            if (maxNodes < 0 || maxEdges < 0 || maxCategories < 0 || maxTopics < 0) {
                throw new ConfigurationException("budget", "count budgets must not be negative");
            }
            if (categoryFocus < 1.0) {
                throw new ConfigurationException("budget.category-focus", "must be at least 1.0");
            }
            if (historySize < 1) {
                throw new ConfigurationException("budget.history-size", "must be positive");
            }
            double low = multiplier("low");
            double normal = multiplier("normal");
            double high = multiplier("high");
            if (low <= 0 || low > normal || normal > high) {
                throw new ConfigurationException("budget.priority-multipliers",
                        "multipliers must be positive and non-decreasing low -> normal -> high");
            }
        }

        /**
         * Multiplier for a priority level name; missing entries count as 1.0.
         */
        public double multiplier(String priority) {
            if (priorityMultipliers == null) {
                return 1.0;
            }
            Double value = priorityMultipliers.get(priority);
            return value != null ? value : 1.0;
        }
    }

    /**
     * Weight learning settings.
     */
    @Data
    public static class Learning {

        /**
         * Step size of the per-outcome weight nudge.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rate = 0.05;

        @Min(1)
        private int corePoolSize = 1;

        @Min(1)
        private int maxPoolSize = 2;

        @Min(0)
        private int queueCapacity = 100;

        void validate() {
            requireUnitInterval("learning.rate", rate);
            if (corePoolSize < 1 || maxPoolSize < corePoolSize) {
                throw new ConfigurationException("learning.max-pool-size", "must be >= core-pool-size >= 1");
            }
        }
    }

    /**
     * Entity seeding settings.
     */
    @Data
    public static class Entities {

        /**
         * Entities sampled from the graph for ranking and type detection.
         */
        @Min(0)
        private int sampleSize = 20;

        /**
         * Ranked entities kept as traversal seeds in the plan.
         */
        @Min(0)
        private int topK = 10;

        void validate() {
            if (sampleSize < 0 || topK < 0) {
                throw new ConfigurationException("entities", "sizes must not be negative");
            }
        }
    }
}
