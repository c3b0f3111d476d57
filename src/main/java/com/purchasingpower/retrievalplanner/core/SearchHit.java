package com.purchasingpower.retrievalplanner.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One match returned by a {@link VectorSearch}.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchHit {

    String id;
    double score;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * Metadata value as a string, or {@code null} when absent.
     */
    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
