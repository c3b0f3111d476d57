package com.purchasingpower.retrievalplanner.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy and pattern-specific preferences for the graph walk.
 *
 * Supported strategies and the hints they carry:
 * - topic_focused: targetEntities, prioritizeRelationships
 * - comparison: comparisonEntities, findCommonCategories, findRelationshipsBetween
 * - definition: prioritizeEdgeTypes [instance_of, subclass_of, defined_as]
 * - causal: prioritizeEdgeTypes [causes, caused_by, affects, affected_by]
 * - collection: collectionTarget, prioritizeEdgeTypes [instance_of, subclass_of, example_of, has_example]
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalHints {

    private TraversalStrategy strategy;

    @Builder.Default
    private List<String> targetEntities = new ArrayList<>();

    @Builder.Default
    private List<String> comparisonEntities = new ArrayList<>();

    private boolean findCommonCategories;

    private boolean findRelationshipsBetween;

    private boolean prioritizeRelationships;

    /**
     * Edge types the executor should try first. Only types already present
     * in the traversal plan are reordered.
     */
    @Builder.Default
    private List<String> prioritizeEdgeTypes = new ArrayList<>();

    private String collectionTarget;

    private boolean expandTopics;

    @Builder.Default
    private double topicExpansionFactor = 1.0;
}
