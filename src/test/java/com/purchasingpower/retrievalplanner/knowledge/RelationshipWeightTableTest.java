package com.purchasingpower.retrievalplanner.knowledge;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Relationship Weight Table Tests")
class RelationshipWeightTableTest {

    private final RelationshipWeightTable table = new RelationshipWeightTable();

    @Test
    @DisplayName("Unknown edge types get the default weight")
    void testWeight_UnknownTypesReturnDefault() {
        for (String type : List.of("links_to", "frobnicates", "", "zz_unknown_zz")) {
            assertThat(table.weight(type)).isEqualTo(table.getDefaultWeight());
        }
        assertThat(table.getDefaultWeight()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Lookup ignores case and label format")
    void testWeight_NormalizesLabels() {
        assertThat(table.weight("SUBCLASS_OF")).isEqualTo(1.5);
        assertThat(table.weight("subclassOf")).isEqualTo(1.5);
        assertThat(table.weight("Subclass Of")).isEqualTo(1.5);
        assertThat(table.weight("is-subclass-of")).isEqualTo(1.5);
        assertThat(table.weight("is_instance_of")).isEqualTo(1.4);
        assertThat(table.weight("contains_part")).isEqualTo(1.2);
    }

    @Test
    @DisplayName("Normalize keeps single-word is_ labels")
    void testNormalize_IsPrefixOnlyStrippedForCompoundLabels() {
        assertThat(RelationshipWeightTable.normalize("is_a")).isEqualTo("is_a");
        assertThat(RelationshipWeightTable.normalize("is_part_of")).isEqualTo("part_of");
        assertThat(RelationshipWeightTable.normalize("  Related--To ")).isEqualTo("related_to");
    }

    @Test
    @DisplayName("Prioritize sorts by descending weight")
    void testPrioritize_SortsByWeight() {
        // Given
        List<String> edgeTypes = List.of("mentions", "subclass_of", "instance_of", "related_to");

        // When
        List<String> prioritized = table.prioritize(edgeTypes);

        // Then
        assertThat(prioritized).containsExactly("subclass_of", "instance_of", "related_to", "mentions");
    }

    @Test
    @DisplayName("Prioritize is idempotent and keeps input order on ties")
    void testPrioritize_IdempotentAndStable() {
        List<String> edgeTypes = List.of("created_by", "in_category", "authored_by", "category_contains", "unknown_b", "unknown_a");

        List<String> once = table.prioritize(edgeTypes);
        List<String> twice = table.prioritize(once);

        assertThat(twice).isEqualTo(once);
        assertThat(once).containsExactly("in_category", "category_contains", "created_by", "authored_by",
                "unknown_b", "unknown_a");
    }

    @Test
    @DisplayName("Filter keeps types at or above the threshold in input order")
    void testFilterAbove() {
        List<String> filtered = table.filterAbove(List.of("mentions", "subclass_of", "related_to", "refers_to"), 1.0);

        assertThat(filtered).containsExactly("subclass_of", "related_to");
    }

    @Test
    @DisplayName("Adjust clamps to the allowed weight range")
    void testAdjust_ClampsToRange() {
        assertThat(table.adjust("subclass_of", 5.0)).isEqualTo(PlannerProperties.MAX_EDGE_WEIGHT);
        assertThat(table.weight("subclass_of")).isEqualTo(2.0);

        assertThat(table.adjust("mentions", -5.0)).isEqualTo(PlannerProperties.MIN_EDGE_WEIGHT);
        assertThat(table.weight("mentions")).isEqualTo(0.1);

        assertThat(table.adjust("brand_new_type", 0.1)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Configured overrides replace built-in weights")
    void testConstructor_AppliesOverrides() {
        PlannerProperties properties = new PlannerProperties();
        properties.setEdgeWeights(Map.of("AuthoredBy", 0.9, "links_to", 1.7));

        RelationshipWeightTable configured = new RelationshipWeightTable(properties);

        assertThat(configured.weight("authored_by")).isEqualTo(0.9);
        assertThat(configured.weight("links-to")).isEqualTo(1.7);
        assertThat(configured.weight("subclass_of")).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Out-of-range overrides fail at construction")
    void testConstructor_RejectsMalformedOverrides() {
        PlannerProperties properties = new PlannerProperties();
        properties.setEdgeWeights(Map.of("mentions", 3.5));

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> new RelationshipWeightTable(properties));

        assertThat(error.getProperty()).isEqualTo("edge-weights.mentions");
    }
}
