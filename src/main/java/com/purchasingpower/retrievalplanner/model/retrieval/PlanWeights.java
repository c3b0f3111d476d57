package com.purchasingpower.retrievalplanner.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Blend of vector and graph scores used by the executor when ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanWeights {

    private double vector;

    private double graph;

    /**
     * Extra weight for hierarchical edges. Zero on flat-link graphs.
     */
    private double hierarchicalBonus;
}
