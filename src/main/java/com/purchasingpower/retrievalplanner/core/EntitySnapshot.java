package com.purchasingpower.retrievalplanner.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only feature snapshot of a knowledge-graph entity.
 *
 * <p>Every feature is optional. A {@code null} count or timestamp means the
 * feature is unknown, which scores as neutral rather than as zero.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class EntitySnapshot {

    String id;

    /**
     * Declared entity type, e.g. "category", "article", "topic".
     */
    String type;

    Integer inboundConnections;
    Integer outboundConnections;
    Integer referenceCount;
    Integer mentionCount;

    @Singular
    List<String> categories;

    Instant lastModified;

    /**
     * Snapshot carrying only an id, every feature unknown.
     */
    public static EntitySnapshot neutral(String id) {
        return EntitySnapshot.builder().id(id).build();
    }

    public boolean hasConnectionData() {
        return inboundConnections != null || outboundConnections != null;
    }

    public long totalConnections() {
        long in = inboundConnections != null ? inboundConnections : 0;
        long out = outboundConnections != null ? outboundConnections : 0;
        return Math.max(0, in) + Math.max(0, out);
    }
}
