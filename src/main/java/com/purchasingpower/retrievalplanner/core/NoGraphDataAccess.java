package com.purchasingpower.retrievalplanner.core;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Declared-absent graph: no entities, no relationship types.
 */
final class NoGraphDataAccess implements GraphDataAccess {

    static final NoGraphDataAccess INSTANCE = new NoGraphDataAccess();

    private NoGraphDataAccess() {
    }

    @Override
    public List<EntitySnapshot> getEntities(int limit) {
        return List.of();
    }

    @Override
    public Set<String> getRelationshipTypes() {
        return Set.of();
    }

    @Override
    public Optional<EntitySnapshot> getEntity(String entityId) {
        return Optional.empty();
    }
}
