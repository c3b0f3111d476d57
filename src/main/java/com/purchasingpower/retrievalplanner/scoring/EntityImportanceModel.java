package com.purchasingpower.retrievalplanner.scoring;

import com.purchasingpower.retrievalplanner.core.EntitySnapshot;
import com.purchasingpower.retrievalplanner.core.GraphDataAccess;
import com.purchasingpower.retrievalplanner.exception.GraphAccessException;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks entities by estimated relevance from five features.
 *
 * <pre>
 *   connections   log1p(n) / log1p(100)      x 0.30
 *   references    log1p(n) / log1p(20)       x 0.20
 *   categories    mean category weight       x 0.20
 *   mentions      log1p(n) / log1p(50)       x 0.15
 *   recency       1 - age_days / 365         x 0.15
 * </pre>
 *
 * Every sub-score lies in [0, 1]; an unknown feature scores 0.5. Scores are
 * cached per entity id for the life of the instance, and an entry is only
 * reused when the snapshot and category weights match the ones it was
 * computed from. Create one instance per plan; instances are not thread-safe.
 */
@Slf4j
public class EntityImportanceModel {

    static final double CONNECTION_WEIGHT = 0.30;
    static final double REFERENCE_WEIGHT = 0.20;
    static final double CATEGORY_WEIGHT = 0.20;
    static final double MENTION_WEIGHT = 0.15;
    static final double RECENCY_WEIGHT = 0.15;

    static final double NEUTRAL = 0.5;

    private static final double CONNECTION_SATURATION = Math.log1p(100);
    private static final double REFERENCE_SATURATION = Math.log1p(20);
    private static final double MENTION_SATURATION = Math.log1p(50);
    private static final double DAYS_PER_YEAR = 365.0;

    private final Clock clock;
    private final PlanTracer tracer;
    private final Map<String, CachedScore> cache = new HashMap<>();

    public EntityImportanceModel(Clock clock, PlanTracer tracer) {
        this.clock = clock;
        this.tracer = tracer;
    }

    public double score(EntitySnapshot entity) {
        return score(entity, null);
    }

    /**
     * Importance of an entity in [0, 1].
     *
     * @param categoryWeights weight per category name; categories missing from
     *                        the map count as 0.5. {@code null} scores the
     *                        category feature as neutral.
     */
    public double score(EntitySnapshot entity, Map<String, Double> categoryWeights) {
        String id = entity.getId();
        if (id != null) {
            CachedScore cached = cache.get(id);
            if (cached != null && cached.matches(entity, categoryWeights)) {
                return cached.score;
            }
        }

        double importance = CONNECTION_WEIGHT * connectionScore(entity)
                + REFERENCE_WEIGHT * logScore(entity.getReferenceCount(), REFERENCE_SATURATION)
                + CATEGORY_WEIGHT * categoryScore(entity, categoryWeights)
                + MENTION_WEIGHT * logScore(entity.getMentionCount(), MENTION_SATURATION)
                + RECENCY_WEIGHT * recencyScore(entity.getLastModified());

        double bounded = Math.max(0.0, Math.min(1.0, importance));
        if (id != null) {
            cache.put(id, new CachedScore(entity, copyOf(categoryWeights), bounded));
        }
        return bounded;
    }

    /**
     * Fetches an entity's features and scores it. A failed or empty lookup
     * scores the entity with every feature unknown.
     */
    public double scoreById(String entityId, GraphDataAccess dataAccess, Map<String, Double> categoryWeights) {
        EntitySnapshot snapshot;
        try {
            snapshot = dataAccess.getEntity(entityId).orElseGet(() -> EntitySnapshot.neutral(entityId));
        } catch (GraphAccessException e) {
            log.warn("Feature lookup for entity '{}' failed, scoring with neutral features: {}",
                    entityId, e.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operation", e.getOperation());
            payload.put("entity_id", entityId);
            payload.put("error", e.getMessage());
            tracer.logEvent(PlanTracer.GRAPH_ACCESS_FAILURE, payload);
            snapshot = EntitySnapshot.neutral(entityId);
        }
        return score(snapshot, categoryWeights);
    }

    /**
     * Entities sorted by descending importance; ties keep input order.
     */
    public List<EntitySnapshot> rank(Collection<EntitySnapshot> entities, Map<String, Double> categoryWeights) {
        Map<EntitySnapshot, Double> scores = new HashMap<>();
        for (EntitySnapshot entity : entities) {
            scores.put(entity, score(entity, categoryWeights));
        }
        List<EntitySnapshot> ranked = new ArrayList<>(entities);
        ranked.sort(Comparator.comparingDouble((EntitySnapshot e) -> scores.get(e)).reversed());
        return ranked;
    }

    public List<EntitySnapshot> rank(Collection<EntitySnapshot> entities) {
        return rank(entities, null);
    }

    private double connectionScore(EntitySnapshot entity) {
        if (!entity.hasConnectionData()) {
            return NEUTRAL;
        }
        return logScore(entity.totalConnections(), CONNECTION_SATURATION);
    }

    private static double logScore(Integer count, double saturation) {
        if (count == null) {
            return NEUTRAL;
        }
        return logScore(count.longValue(), saturation);
    }

    private static double logScore(long count, double saturation) {
        return Math.min(1.0, Math.log1p(Math.max(0L, count)) / saturation);
    }

    private static double categoryScore(EntitySnapshot entity, Map<String, Double> categoryWeights) {
        List<String> categories = entity.getCategories();
        if (categoryWeights == null || categoryWeights.isEmpty() || categories.isEmpty()) {
            return NEUTRAL;
        }
        double sum = 0.0;
        for (String category : categories) {
            Double weight = categoryWeights.get(category);
            sum += weight != null ? weight : NEUTRAL;
        }
        return Math.max(0.0, Math.min(1.0, sum / categories.size()));
    }

    private double recencyScore(Instant lastModified) {
        if (lastModified == null) {
            return NEUTRAL;
        }
        double ageDays = Duration.between(lastModified, clock.instant()).getSeconds() / (24.0 * 3600);
        return Math.max(0.0, Math.min(1.0, 1.0 - ageDays / DAYS_PER_YEAR));
    }

    private static Map<String, Double> copyOf(Map<String, Double> weights) {
        return weights != null ? new HashMap<>(weights) : null;
    }

    private static final class CachedScore {
        private final EntitySnapshot snapshot;
        private final Map<String, Double> categoryWeights;
        private final double score;

        private CachedScore(EntitySnapshot snapshot, Map<String, Double> categoryWeights, double score) {
            this.snapshot = snapshot;
            this.categoryWeights = categoryWeights;
            this.score = score;
        }

        private boolean matches(EntitySnapshot other, Map<String, Double> otherWeights) {
            return snapshot.equals(other) && Objects.equals(categoryWeights, otherWeights);
        }
    }
}
