package com.purchasingpower.retrievalplanner.model.retrieval;

import com.purchasingpower.retrievalplanner.core.Priority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Planning request. Only {@link #queryVector} is mandatory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanQuery {

    private String queryId;

    private double[] queryVector;

    /**
     * Optional natural-language form of the query; enables expansion and
     * pattern detection.
     */
    private String queryText;

    @Builder.Default
    private int maxVectorResults = 5;

    @Builder.Default
    private int maxTraversalDepth = 2;

    /**
     * Edge types to plan; empty means the graph's own relationship types.
     */
    @Builder.Default
    private List<String> edgeTypes = new ArrayList<>();

    @Builder.Default
    private double minSimilarity = 0.5;

    @Builder.Default
    private Priority priority = Priority.NORMAL;

    private boolean expandTopics;

    @Builder.Default
    private double topicExpansionFactor = 1.0;

    @Builder.Default
    private List<String> categoryFilter = new ArrayList<>();

    /**
     * Total node budget for the walk; {@code null} uses the configured max nodes.
     */
    private Integer nodeBudget;

    public boolean hasText() {
        return queryText != null && !queryText.isBlank();
    }
}
