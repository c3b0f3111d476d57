package com.purchasingpower.retrievalplanner.traversal;

import com.purchasingpower.retrievalplanner.knowledge.RelationshipWeightTable;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Traversal Planner Tests")
class TraversalPlannerTest {

    private TraversalPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new TraversalPlanner(new RelationshipWeightTable(), 1.5);
    }

    @Test
    @DisplayName("Orders edge types by weight and schedules levels")
    void testPlan_BasicSchedule() {
        // When
        TraversalPlan plan = planner.plan(List.of("mentions", "related_to", "subclass_of"), 2, 100);

        // Then
        assertThat(plan.getEdgeTypes()).containsExactly("subclass_of", "related_to", "mentions");
        assertThat(plan.getLevelBudgets()).containsExactly(40, 14);
        assertThat(plan.getActiveDepths()).containsExactly(
                Map.entry("subclass_of", 2),
                Map.entry("related_to", 1),
                Map.entry("mentions", 1));
        assertThat(plan.getTraversalCosts()).containsEntry("subclass_of", 0.6)
                .containsEntry("related_to", 1.0)
                .containsEntry("mentions", 1.5);
        assertEquals(2, plan.getMaxDepth());
        assertEquals(1.5, plan.getHierarchicalWeight());
    }

    @ParameterizedTest(name = "depth {0}, budget {1}")
    @CsvSource({"1, 100", "2, 1000", "3, 1000", "5, 37", "8, 10000", "4, 0"})
    @DisplayName("Level budgets have one entry per level, never increase and never exceed the total")
    void testLevelBudgets_Shape(int maxDepth, int total) {
        List<Integer> budgets = TraversalPlanner.levelBudgets(maxDepth, total);

        assertEquals(maxDepth, budgets.size());
        for (int i = 1; i < budgets.size(); i++) {
            assertTrue(budgets.get(i) <= budgets.get(i - 1), "level " + i + " grew: " + budgets);
        }
        assertThat(budgets.stream().mapToInt(Integer::intValue).sum()).isLessThanOrEqualTo(total);
        assertThat(budgets).allMatch(b -> b >= 0);
    }

    @Test
    @DisplayName("Active depth decreases with rank and stays within [1, maxDepth]")
    void testActiveDepth() {
        assertEquals(3, TraversalPlanner.activeDepth(0, 4, 3));
        assertEquals(2, TraversalPlanner.activeDepth(1, 4, 3));
        assertEquals(1, TraversalPlanner.activeDepth(2, 4, 3));
        assertEquals(1, TraversalPlanner.activeDepth(3, 4, 3));
        assertEquals(4, TraversalPlanner.activeDepth(0, 1, 4), "a single edge type walks the full depth");
    }

    @Test
    @DisplayName("Preferred edge types move to the front")
    void testPlan_PreferredEdgeTypes() {
        TraversalPlan plan = planner.plan(
                List.of("related_to", "subclass_of", "causes"), 2, 100, List.of("Causes", "defined_as"));

        assertThat(plan.getEdgeTypes()).containsExactly("causes", "subclass_of", "related_to");
        assertEquals(2, plan.getActiveDepths().get("causes"));
    }

    @Test
    @DisplayName("Duplicate edge types are planned once")
    void testPlan_Deduplicates() {
        TraversalPlan plan = planner.plan(List.of("part_of", "part_of", "related_to"), 2, 100);

        assertThat(plan.getEdgeTypes()).containsExactly("part_of", "related_to");
    }

    @Test
    @DisplayName("No edge types means an empty plan")
    void testPlan_NoEdgeTypes() {
        TraversalPlan plan = planner.plan(List.of(), 3, 1000);

        assertTrue(plan.isEmpty());
        assertThat(plan.getLevelBudgets()).isEmpty();
        assertEquals(0, plan.totalLevelBudget());
    }

    @Test
    @DisplayName("Negative depth or budget is rejected")
    void testPlan_RejectsNegativeArguments() {
        assertThrows(IllegalArgumentException.class, () -> planner.plan(List.of("part_of"), -1, 100));
        assertThrows(IllegalArgumentException.class, () -> planner.plan(List.of("part_of"), 2, -5));
    }

    @Test
    @DisplayName("Unknown edge types cost 1.0")
    void testTraversalCost_Default() {
        assertEquals(1.0, TraversalPlanner.traversalCost("orbits"));
        assertEquals(0.6, TraversalPlanner.traversalCost("Subclass Of"));
    }
}
