package com.purchasingpower.retrievalplanner.knowledge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Category Graph Tests")
class CategoryGraphTest {

    private CategoryGraph graph;

    @BeforeEach
    void setUp() {
        graph = new CategoryGraph();
    }

    @Nested
    @DisplayName("depth")
    class Depth {

        @Test
        @DisplayName("Roots have depth 0 and each level adds one")
        void testDepth_Chain() {
            // Given: A -> B -> C -> D
            graph.registerEdge("A", "B");
            graph.registerEdge("B", "C");
            graph.registerEdge("C", "D");

            // Then
            assertThat(graph.depth("A")).isZero();
            assertThat(graph.depth("B")).isEqualTo(1);
            assertThat(graph.depth("C")).isEqualTo(2);
            assertThat(graph.depth("D")).isEqualTo(3);
        }

        @Test
        @DisplayName("Science -> Physics -> Quantum_Physics puts Quantum_Physics at depth 2")
        void testDepth_ScienceHierarchy() {
            graph.registerEdge("Science", "Physics");
            graph.registerEdge("Physics", "Quantum_Physics");

            assertThat(graph.depth("Quantum_Physics")).isEqualTo(2);
        }

        @Test
        @DisplayName("Depth follows the deepest parent")
        void testDepth_MultipleParents() {
            graph.registerEdge("Root", "Shallow");
            graph.registerEdge("Root", "Mid");
            graph.registerEdge("Mid", "Deep");
            graph.registerEdge("Shallow", "Leaf");
            graph.registerEdge("Deep", "Leaf");

            assertThat(graph.depth("Leaf")).isEqualTo(3);
        }

        @Test
        @DisplayName("A three-node cycle terminates with a bounded depth")
        void testDepth_CycleTerminates() {
            // Given: A -> B -> C -> A
            graph.registerEdge("A", "B");
            graph.registerEdge("B", "C");
            graph.registerEdge("C", "A");

            // When
            int depthA = graph.depth("A");

            // Then: the re-entered node contributes 0, every node on the walk is memoized
            assertThat(depthA).isEqualTo(3);
            assertThat(graph.depth("B")).isEqualTo(1);
            assertThat(graph.depth("C")).isEqualTo(2);
            assertThat(depthA).isLessThanOrEqualTo(graph.size());
        }

        @Test
        @DisplayName("A self-loop terminates")
        void testDepth_SelfLoop() {
            graph.registerEdge("Loop", "Loop");

            assertThat(graph.depth("Loop")).isBetween(0, 1);
        }

        @Test
        @DisplayName("Unknown categories have depth 0")
        void testDepth_Unknown() {
            assertThat(graph.depth("Nowhere")).isZero();
        }

        @Test
        @DisplayName("Memoized depths survive new edges until the cache is cleared")
        void testDepth_CacheInvalidatedOnlyByClear() {
            graph.registerEdge("Science", "Physics");
            assertThat(graph.depth("Physics")).isEqualTo(1);

            graph.registerEdge("Knowledge", "Science");
            assertThat(graph.depth("Physics")).isEqualTo(1);

            graph.clearDepthCache();
            assertThat(graph.depth("Physics")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("related")
    class Related {

        @BeforeEach
        void buildHierarchy() {
            graph.registerEdge("Science", "Physics");
            graph.registerEdge("Science", "Chemistry");
            graph.registerEdge("Physics", "Quantum_Physics");
        }

        @Test
        @DisplayName("Walks child and parent edges alike")
        void testRelated_Bidirectional() {
            List<Map.Entry<String, Integer>> related = graph.related("Physics", 1);

            assertThat(related).extracting(Map.Entry::getKey)
                    .containsExactlyInAnyOrder("Quantum_Physics", "Science");
            assertThat(related).extracting(Map.Entry::getValue).containsOnly(1);
        }

        @Test
        @DisplayName("Reports distances up to the limit")
        void testRelated_Distances() {
            List<Map.Entry<String, Integer>> related = graph.related("Quantum_Physics", 2);

            assertThat(related).containsExactlyInAnyOrder(
                    Map.entry("Physics", 1),
                    Map.entry("Science", 2));
        }

        @Test
        @DisplayName("Never includes the source category, even on cycles")
        void testRelated_ExcludesSource() {
            graph.registerEdge("Quantum_Physics", "Physics");

            assertThat(graph.related("Physics", 1)).extracting(Map.Entry::getKey).doesNotContain("Physics");
            assertThat(graph.related("Physics", 3)).extracting(Map.Entry::getKey).doesNotContain("Physics");
        }

        @Test
        @DisplayName("Distance 0 finds nothing")
        void testRelated_ZeroDistance() {
            assertThat(graph.related("Physics", 0)).isEmpty();
        }
    }

    @Test
    @DisplayName("Category weights scale with depth and similarity")
    void testWeightsFor() {
        graph.registerEdge("Science", "Physics");
        graph.registerEdge("Physics", "Quantum_Physics");

        Map<String, Double> weights = graph.weightsFor(
                List.of("Science", "Quantum_Physics", "Physics"), Map.of("Physics", 0.5));

        assertThat(weights.get("Science")).isCloseTo(0.5, within(1e-9));
        assertThat(weights.get("Quantum_Physics")).isCloseTo(0.7, within(1e-9));
        assertThat(weights.get("Physics")).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("Registering an edge twice changes nothing")
    void testRegisterEdge_Idempotent() {
        graph.registerEdge("Science", "Physics");
        graph.registerEdge("Science", "Physics");

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.related("Science", 1)).hasSize(1);
        assertThat(graph.categories()).containsExactly("Science", "Physics");
    }
}
