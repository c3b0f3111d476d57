package com.purchasingpower.retrievalplanner.model.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Topics and categories added to a query before planning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpansionResult {

    @JsonIgnore
    private double[] queryVector;

    private String queryText;

    /**
     * Topics sorted by descending similarity.
     */
    @Builder.Default
    private List<TopicExpansion> topics = new ArrayList<>();

    /**
     * Categories sorted by descending depth.
     */
    @Builder.Default
    private List<CategoryExpansion> categories = new ArrayList<>();

    @JsonProperty("hasExpansions")
    public boolean hasExpansions() {
        return !topics.isEmpty() || !categories.isEmpty();
    }

    public static ExpansionResult empty(double[] queryVector, String queryText) {
        return ExpansionResult.builder()
                .queryVector(queryVector)
                .queryText(queryText)
                .build();
    }
}
