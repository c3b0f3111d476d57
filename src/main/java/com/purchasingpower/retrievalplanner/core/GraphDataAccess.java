package com.purchasingpower.retrievalplanner.core;

import com.purchasingpower.retrievalplanner.exception.GraphAccessException;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Capability interface over the caller's knowledge graph.
 *
 * <p>Implementations report what they can do explicitly; a graph with no data
 * is represented by {@link #none()}, never by {@code null}. Any lookup may
 * throw {@link GraphAccessException}, which the planner recovers from.
 *
 * @since 1.0.0
 */
public interface GraphDataAccess {

    /**
     * Graph type declared by the store itself, if it knows it.
     */
    default Optional<String> getDeclaredGraphType() {
        return Optional.empty();
    }

    /**
     * Sample of entities, at most {@code limit}.
     */
    List<EntitySnapshot> getEntities(int limit);

    /**
     * Relationship (edge) type labels present in the graph.
     */
    Set<String> getRelationshipTypes();

    /**
     * Feature lookup for a single entity.
     */
    Optional<EntitySnapshot> getEntity(String entityId);

    /**
     * Accessor for a planner invoked without graph data.
     */
    static GraphDataAccess none() {
        return NoGraphDataAccess.INSTANCE;
    }
}
