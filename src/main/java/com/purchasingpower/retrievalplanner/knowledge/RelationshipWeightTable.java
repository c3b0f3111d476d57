package com.purchasingpower.retrievalplanner.knowledge;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Priority weights per edge-type label.
 *
 * <p>Lives for the whole process and is nudged in place by the learning loop.
 * Every stored weight stays inside [{@value PlannerProperties#MIN_EDGE_WEIGHT},
 * {@value PlannerProperties#MAX_EDGE_WEIGHT}]. Reads share a read lock, writes
 * take the write lock.
 *
 * @since 1.0.0
 */
@Slf4j
public class RelationshipWeightTable {

    static final Map<String, Double> DEFAULT_WEIGHTS;

    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        // Hierarchical
        weights.put("subclass_of", 1.5);
        weights.put("instance_of", 1.4);
        weights.put("part_of", 1.3);
        weights.put("has_part", 1.2);
        // Category
        weights.put("category_contains", 1.3);
        weights.put("in_category", 1.3);
        // Topic
        weights.put("related_to", 1.0);
        weights.put("similar_to", 0.9);
        weights.put("refers_to", 0.8);
        // Authorship
        weights.put("created_by", 0.7);
        weights.put("authored_by", 0.7);
        weights.put("developed_by", 0.7);
        // Temporal
        weights.put("preceded_by", 0.6);
        weights.put("succeeded_by", 0.6);
        // Causal
        weights.put("causes", 1.1);
        weights.put("caused_by", 1.1);
        // High fan-out
        weights.put("mentions", 0.5);
        weights.put("mentioned_in", 0.5);
        DEFAULT_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private static final Map<String, String> ALIASES = Map.of(
            "contains_part", "has_part",
            "member_of_category", "in_category");

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-.]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final double defaultWeight;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RelationshipWeightTable() {
        this(new PlannerProperties());
    }

    public RelationshipWeightTable(PlannerProperties properties) {
        properties.validate();
        this.defaultWeight = properties.getDefaultEdgeWeight();
        weights.putAll(DEFAULT_WEIGHTS);
        if (properties.getEdgeWeights() != null) {
            properties.getEdgeWeights().forEach((type, weight) -> weights.put(normalize(type), weight));
        }
        log.debug("Relationship weight table initialized: {} types, default {}", weights.size(), defaultWeight);
    }

    /**
     * Canonical form of an edge-type label: lower snake_case, with
     * {@code is_X_of}-style variants collapsed to {@code X_of}.
     */
    public static String normalize(String edgeType) {
        if (edgeType == null) {
            return "";
        }
        String normalized = CAMEL_BOUNDARY.matcher(edgeType.trim()).replaceAll("$1_$2");
        normalized = SEPARATORS.matcher(normalized.toLowerCase(Locale.ROOT)).replaceAll("_");
        normalized = REPEATED_UNDERSCORES.matcher(normalized).replaceAll("_");
        if (normalized.startsWith("is_") && normalized.indexOf('_', 3) > 3) {
            normalized = normalized.substring(3);
        }
        return ALIASES.getOrDefault(normalized, normalized);
    }

    /**
     * Weight for an edge type; unknown types get the configured default.
     */
    public double weight(String edgeType) {
        String key = normalize(edgeType);
        lock.readLock().lock();
        try {
            return weights.getOrDefault(key, defaultWeight);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Edge types sorted by descending weight. The sort is stable, so equal
     * weights keep their input order and an already prioritized list comes
     * back unchanged.
     */
    public List<String> prioritize(List<String> edgeTypes) {
        List<String> sorted = new ArrayList<>(edgeTypes);
        Map<String, Double> snapshot = snapshot();
        sorted.sort(Comparator.comparingDouble(
                (String type) -> snapshot.getOrDefault(normalize(type), defaultWeight)).reversed());
        return sorted;
    }

    /**
     * Edge types whose weight is at least {@code minWeight}, in input order.
     */
    public List<String> filterAbove(List<String> edgeTypes, double minWeight) {
        return edgeTypes.stream()
                .filter(type -> weight(type) >= minWeight)
                .collect(Collectors.toList());
    }

    /**
     * Adds {@code delta} to an edge type's weight, clamped to the allowed range.
     *
     * @return the stored weight after adjustment
     */
    public double adjust(String edgeType, double delta) {
        String key = normalize(edgeType);
        lock.writeLock().lock();
        try {
            double current = weights.getOrDefault(key, defaultWeight);
            double updated = clamp(current + delta);
            weights.put(key, updated);
            log.debug("Adjusted weight of '{}': {} -> {}", key, current, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    /**
     * Copy of every explicitly weighted type.
     */
    public Map<String, Double> snapshot() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(weights);
        } finally {
            lock.readLock().unlock();
        }
    }

    static double clamp(double weight) {
        return Math.max(PlannerProperties.MIN_EDGE_WEIGHT, Math.min(PlannerProperties.MAX_EDGE_WEIGHT, weight));
    }
}
