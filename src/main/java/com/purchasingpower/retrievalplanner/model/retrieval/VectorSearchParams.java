package com.purchasingpower.retrievalplanner.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the vector-similarity phase.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorSearchParams {

    private int topK;

    private double minScore;

    /**
     * Category filter copied from the query. Empty means unfiltered.
     */
    @Builder.Default
    private List<String> categories = new ArrayList<>();
}
