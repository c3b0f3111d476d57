package com.purchasingpower.retrievalplanner.budget;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.core.ExecutionResult;
import com.purchasingpower.retrievalplanner.core.Priority;
import com.purchasingpower.retrievalplanner.exception.ConfigurationException;
import com.purchasingpower.retrievalplanner.model.retrieval.Budget;
import com.purchasingpower.retrievalplanner.model.retrieval.ExecutionPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalHints;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalStrategy;
import com.purchasingpower.retrievalplanner.model.retrieval.VectorSearchParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for BudgetAllocator
 *
 * Plans below use topK 5, depth 2 and two edge types, which estimates as
 * MEDIUM complexity (multiplier 1.0) so the configured defaults show through.
 */
@DisplayName("Budget Allocator Tests")
class BudgetAllocatorTest {

    private BudgetAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new BudgetAllocator(new PlannerProperties());
    }

    @Nested
    @DisplayName("allocate")
    class Allocate {

        @Test
        @DisplayName("Standard plan at normal priority gets the configured defaults")
        void testAllocate_Defaults() {
            Budget budget = allocator.allocate(plan(List.of("subclass_of", "related_to"), TraversalStrategy.STANDARD),
                    Priority.NORMAL);

            assertEquals(500, budget.getVectorSearchMs());
            assertEquals(1000, budget.getGraphTraversalMs());
            assertEquals(200, budget.getRankingMs());
            assertEquals(2000, budget.getTimeoutMs());
            assertEquals(1000, budget.getMaxNodes());
            assertEquals(5000, budget.getMaxEdges());
            assertEquals(20, budget.getMaxCategories());
        }

        @Test
        @DisplayName("Budgets never shrink as priority rises")
        void testAllocate_PriorityMonotonic() {
            // Given
            ExecutionPlan plan = plan(List.of("subclass_of", "related_to"), TraversalStrategy.HIERARCHICAL);

            // When
            Map<String, Double> low = allocator.allocate(plan, Priority.LOW).asMap();
            Map<String, Double> normal = allocator.allocate(plan, Priority.NORMAL).asMap();
            Map<String, Double> high = allocator.allocate(plan, Priority.HIGH).asMap();

            // Then
            low.forEach((resource, value) -> {
                assertThat(value).as(resource + " low <= normal").isLessThanOrEqualTo(normal.get(resource));
                assertThat(normal.get(resource)).as(resource + " normal <= high").isLessThanOrEqualTo(high.get(resource));
            });
            assertThat(high.get(Budget.VECTOR_SEARCH_MS)).isEqualTo(750.0);
            assertThat(low.get(Budget.VECTOR_SEARCH_MS)).isEqualTo(250.0);
        }

        @Test
        @DisplayName("Category edges enlarge the category budget")
        void testAllocate_CategoryFocus() {
            Budget budget = allocator.allocate(plan(List.of("in_category", "related_to"), TraversalStrategy.STANDARD),
                    Priority.NORMAL);

            assertEquals(7500, budget.getCategoryTraversalMs());
            assertEquals(30, budget.getMaxCategories());
            assertEquals(1000, budget.getGraphTraversalMs());
        }

        @Test
        @DisplayName("Strategies add their bonuses")
        void testAllocate_StrategyBonuses() {
            List<String> edges = List.of("subclass_of", "related_to");

            Budget hierarchical = allocator.allocate(plan(edges, TraversalStrategy.HIERARCHICAL), Priority.NORMAL);
            Budget topicFocused = allocator.allocate(plan(edges, TraversalStrategy.TOPIC_FOCUSED), Priority.NORMAL);
            Budget comparison = allocator.allocate(plan(edges, TraversalStrategy.COMPARISON), Priority.NORMAL);

            assertEquals(1300, hierarchical.getGraphTraversalMs());
            assertEquals(1300, hierarchical.getMaxNodes());
            assertEquals(500, hierarchical.getVectorSearchMs());

            assertEquals(700, topicFocused.getVectorSearchMs());
            assertEquals(1000, topicFocused.getGraphTraversalMs());

            assertEquals(600, comparison.getVectorSearchMs());
            assertEquals(1200, comparison.getGraphTraversalMs());
        }

        @Test
        @DisplayName("Topic expansion scales the topic budget by its factor")
        void testAllocate_TopicExpansion() {
            ExecutionPlan plan = plan(List.of("subclass_of", "related_to"), TraversalStrategy.STANDARD);
            plan.getHints().setExpandTopics(true);
            plan.getHints().setTopicExpansionFactor(2.0);

            Budget budget = allocator.allocate(plan, Priority.NORMAL);

            assertEquals(6000, budget.getTopicExpansionMs());
            assertEquals(30, budget.getMaxTopics());
        }

        @Test
        @DisplayName("Vector-only plans get no graph budget")
        void testAllocate_VectorOnly() {
            // Given: topK 5, no edges -> LOW complexity (0.7)
            ExecutionPlan plan = plan(List.of(), TraversalStrategy.VECTOR_ONLY);

            // When
            Budget budget = allocator.allocate(plan, Priority.HIGH);

            // Then
            assertEquals(0, budget.getGraphTraversalMs());
            assertEquals(0, budget.getCategoryTraversalMs());
            assertEquals(0, budget.getMaxNodes());
            assertEquals(0, budget.getMaxEdges());
            assertEquals(0, budget.getMaxCategories());
            assertEquals(525, budget.getVectorSearchMs());
        }

        @Test
        @DisplayName("Historical consumption raises allocations to its floor")
        void testAllocate_HistoricalFloor() {
            // Given
            for (int i = 0; i < 10; i++) {
                allocator.recordConsumption(Map.of(Budget.VECTOR_SEARCH_MS, 900.0, "gpu_seconds", 3.0));
            }
            allocator.recordConsumption(Map.of(Budget.RANKING_MS, 10.0));

            // When
            Budget budget = allocator.allocate(plan(List.of("subclass_of", "related_to"), TraversalStrategy.STANDARD),
                    Priority.NORMAL);

            // Then
            assertEquals(900, budget.getVectorSearchMs());
            assertEquals(200, budget.getRankingMs(), "the floor never lowers an allocation");
        }
    }

    @Nested
    @DisplayName("shouldStopEarly")
    class EarlyStopping {

        @Test
        @DisplayName("Three confident category results stop once 60% is used")
        void testShouldStopEarly_ConfidentCategories() {
            List<ExecutionResult> results = List.of(
                    category("c1", 0.9, "Physics"),
                    category("c2", 0.88, "Chemistry"),
                    category("c3", 0.95, "Biology"));

            assertTrue(allocator.shouldStopEarly(results, 0.6));
            assertFalse(allocator.shouldStopEarly(results, 0.5));
        }

        @Test
        @DisplayName("Redundant categories stop once 70% is used")
        void testShouldStopEarly_RedundantCategories() {
            List<ExecutionResult> results = IntStream.range(0, 11)
                    .mapToObj(i -> ExecutionResult.builder().id("r" + i).type("article").category("Physics").build())
                    .collect(Collectors.toList());

            assertTrue(allocator.shouldStopEarly(results, 0.7));
            assertFalse(allocator.shouldStopEarly(results, 0.65));
        }

        @Test
        @DisplayName("Falls back to the score-drop heuristic")
        void testShouldStopEarly_ScoreDrop() {
            List<ExecutionResult> results = new ArrayList<>();
            double[] scores = {0.95, 0.9, 0.8, 0.7, 0.5, 0.4};
            for (int i = 0; i < scores.length; i++) {
                results.add(ExecutionResult.builder().id("r" + i).type("article").score(scores[i]).build());
            }

            assertTrue(allocator.shouldStopEarly(results, 0.1));
        }

        @Test
        @DisplayName("No results never stops")
        void testShouldStopEarly_Empty() {
            assertFalse(allocator.shouldStopEarly(List.of(), 0.99));
            assertFalse(allocator.shouldStopEarly(null, 0.99));
        }
    }

    @Test
    @DisplayName("Consumption report compares use against allocation")
    void testConsumptionReport() {
        Budget budget = Budget.builder().vectorSearchMs(500).graphTraversalMs(1000).build();

        ConsumptionReport report = allocator.consumptionReport(budget, Map.of(
                Budget.VECTOR_SEARCH_MS, 250.0,
                Budget.GRAPH_TRAVERSAL_MS, 1000.0,
                "unknown", 5.0));

        assertThat(report.getRatios()).containsOnlyKeys(Budget.VECTOR_SEARCH_MS, Budget.GRAPH_TRAVERSAL_MS);
        assertThat(report.getRatios().get(Budget.VECTOR_SEARCH_MS)).isCloseTo(0.5, within(1e-9));
        assertThat(report.getOverallRatio()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("Invalid budget configuration is rejected at construction")
    void testConstructor_InvalidConfiguration() {
        PlannerProperties properties = new PlannerProperties();
        properties.getBudget().setPriorityMultipliers(Map.of("low", 2.0, "normal", 1.0, "high", 1.5));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new BudgetAllocator(properties));
        assertEquals("budget.priority-multipliers", ex.getProperty());
    }

    private static ExecutionPlan plan(List<String> edgeTypes, TraversalStrategy strategy) {
        TraversalPlan traversal = edgeTypes.isEmpty()
                ? TraversalPlan.empty()
                : TraversalPlan.builder().edgeTypes(new ArrayList<>(edgeTypes)).maxDepth(2).build();
        return ExecutionPlan.builder()
                .vectorParams(VectorSearchParams.builder().topK(5).minScore(0.5).build())
                .traversal(traversal)
                .hints(TraversalHints.builder().strategy(strategy).build())
                .build();
    }

    private static ExecutionResult category(String id, double score, String name) {
        return ExecutionResult.builder().id(id).type("category").score(score).category(name).build();
    }
}
