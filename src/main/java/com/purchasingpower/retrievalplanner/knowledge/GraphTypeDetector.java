package com.purchasingpower.retrievalplanner.knowledge;

import com.purchasingpower.retrievalplanner.core.EntitySnapshot;
import com.purchasingpower.retrievalplanner.core.GraphType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies a knowledge graph as hierarchical or flat-link from a sample of
 * its entities and its relationship types.
 *
 * <p>A declared type always wins. Otherwise each sampled entity whose type
 * contains a vocabulary word, and each relationship type in a vocabulary,
 * counts one indicator; the larger count wins and a tie is UNKNOWN.
 */
@Slf4j
public class GraphTypeDetector {

    private static final List<String> HIERARCHICAL_ENTITY_TYPES =
            List.of("category", "article", "wikidata", "topic");
    private static final Set<String> HIERARCHICAL_RELATIONSHIPS =
            Set.of("subclass_of", "instance_of", "category_contains", "article_in_category");

    private static final List<String> FLAT_LINK_ENTITY_TYPES =
            List.of("ipld", "cid", "dag", "content_addressed");
    private static final Set<String> FLAT_LINK_RELATIONSHIPS =
            Set.of("links_to", "references", "contains_hash", "content_references");

    public GraphType detect(String declaredType, Collection<EntitySnapshot> sampledEntities,
                            Collection<String> relationshipTypes) {
        if (declaredType != null && !declaredType.isBlank()) {
            GraphType declared = GraphType.fromDeclared(declaredType);
            log.debug("Using declared graph type '{}' -> {}", declaredType, declared);
            return declared;
        }

        int hierarchical = 0;
        int flatLink = 0;

        for (EntitySnapshot entity : sampledEntities) {
            if (entity.getType() == null) continue;
            String type = entity.getType().toLowerCase(Locale.ROOT);
            if (containsAny(type, HIERARCHICAL_ENTITY_TYPES)) hierarchical++;
            if (containsAny(type, FLAT_LINK_ENTITY_TYPES)) flatLink++;
        }

        for (String relationship : relationshipTypes) {
            String normalized = RelationshipWeightTable.normalize(relationship);
            if (HIERARCHICAL_RELATIONSHIPS.contains(normalized)) hierarchical++;
            if (FLAT_LINK_RELATIONSHIPS.contains(normalized)) flatLink++;
        }

        GraphType detected;
        if (hierarchical > flatLink) {
            detected = GraphType.HIERARCHICAL;
        } else if (flatLink > hierarchical) {
            detected = GraphType.FLAT_LINK;
        } else {
            detected = GraphType.UNKNOWN;
        }
        log.debug("Detected graph type {} (hierarchical={}, flatLink={})", detected, hierarchical, flatLink);
        return detected;
    }

    private static boolean containsAny(String value, List<String> words) {
        return words.stream().anyMatch(value::contains);
    }
}
