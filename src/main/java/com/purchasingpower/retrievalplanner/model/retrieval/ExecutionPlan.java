package com.purchasingpower.retrievalplanner.model.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.retrievalplanner.core.GraphType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ExecutionPlan - everything an executor needs to run one hybrid query.
 *
 * Example (as a document):
 * <pre>
 * {
 *   "planId": "4f1c...",
 *   "vectorParams": {"topK": 5, "minScore": 0.5, "categories": []},
 *   "traversal": {"edgeTypes": ["subclass_of", "related_to"], "levelBudgets": [400, 140], ...},
 *   "hints": {"strategy": "definition", "prioritizeEdgeTypes": ["instance_of", "subclass_of"]},
 *   "budget": {"vectorSearchMs": 500, "graphTraversalMs": 1300, "maxNodes": 1300, ...},
 *   "weights": {"vector": 0.7, "graph": 0.3, "hierarchicalBonus": 0.2},
 *   "graphType": "hierarchical",
 *   "detectedPattern": "definition"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionPlan {

    /**
     * Metrics tracking id, {@code null} when metrics are disabled.
     */
    private String planId;

    private String queryId;

    private VectorSearchParams vectorParams;

    private TraversalPlan traversal;

    private TraversalHints hints;

    private Budget budget;

    private PlanWeights weights;

    private ExpansionResult expansion;

    private GraphType graphType;

    /**
     * Name of the detected query pattern, if any.
     */
    private String detectedPattern;

    @Builder.Default
    private List<EntitySeed> entitySeeds = new ArrayList<>();

    public boolean hasGraphTraversal() {
        return traversal != null && !traversal.isEmpty();
    }
}
