package com.purchasingpower.retrievalplanner.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Effective query parameters after statistics-based adaptation.
 */
@Value
@Builder(toBuilder = true)
public class OptimizedParameters {
    int topK;
    int maxTraversalDepth;
    List<String> edgeTypes;
    double minSimilarity;
    double vectorWeight;
    double graphWeight;
}
