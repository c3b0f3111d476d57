package com.purchasingpower.retrievalplanner.knowledge;

import lombok.extern.slf4j.Slf4j;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Directed hierarchy of categories, built incrementally by the caller for
 * the length of a session.
 *
 * <p>Depths are memoized per instance and survive later edge registrations
 * until {@link #clearDepthCache()} is called. A node met again while its own
 * depth is still being computed contributes 0 for that branch, so cycles
 * always terminate with a depth no larger than the number of categories.
 *
 * @since 1.0.0
 */
@Slf4j
public class CategoryGraph {

    private final Map<String, Set<String>> children = new LinkedHashMap<>();
    private final Map<String, Set<String>> parents = new LinkedHashMap<>();
    private final Map<String, Integer> depthCache = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registers a parent -> child edge. Registering the same edge twice is a no-op.
     */
    public void registerEdge(String parent, String child) {
        if (parent == null || child == null) {
            throw new IllegalArgumentException("Category names must not be null");
        }
        lock.writeLock().lock();
        try {
            children.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
            children.computeIfAbsent(child, k -> new LinkedHashSet<>());
            parents.computeIfAbsent(child, k -> new LinkedHashSet<>()).add(parent);
            parents.computeIfAbsent(parent, k -> new LinkedHashSet<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Depth of a category: 0 without parents, otherwise one more than its
     * deepest parent. Unknown categories have depth 0.
     */
    public int depth(String category) {
        lock.writeLock().lock();
        try {
            return computeDepth(category, new HashSet<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int computeDepth(String category, Set<String> inProgress) {
        Integer cached = depthCache.get(category);
        if (cached != null) {
            return cached;
        }
        if (!inProgress.add(category)) {
            log.trace("Cycle detected at category '{}'", category);
            return 0;
        }

        int depth = 0;
        for (String parent : parents.getOrDefault(category, Set.of())) {
            depth = Math.max(depth, computeDepth(parent, inProgress) + 1);
        }

        depthCache.put(category, depth);
        return depth;
    }

    /**
     * Categories within {@code maxDistance} hops, following child and parent
     * edges alike. The source category is never part of the result.
     *
     * @return (name, distance) pairs in breadth-first order
     */
    public List<Map.Entry<String, Integer>> related(String category, int maxDistance) {
        lock.readLock().lock();
        try {
            List<Map.Entry<String, Integer>> result = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            Queue<String> queue = new LinkedList<>();
            Map<String, Integer> distances = new HashMap<>();

            queue.add(category);
            visited.add(category);
            distances.put(category, 0);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                int currentDistance = distances.get(current);

                if (currentDistance >= maxDistance) continue;

                for (String neighbor : neighbors(current)) {
                    if (!visited.contains(neighbor)) {
                        visited.add(neighbor);
                        queue.add(neighbor);
                        distances.put(neighbor, currentDistance + 1);
                        result.add(new AbstractMap.SimpleImmutableEntry<>(neighbor, currentDistance + 1));
                    }
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<String> neighbors(String category) {
        List<String> neighbors = new ArrayList<>(children.getOrDefault(category, Set.of()));
        neighbors.addAll(parents.getOrDefault(category, Set.of()));
        return neighbors;
    }

    /**
     * Weight per category: {@code (0.5 + min(depth / 10, 1)) * similarity},
     * where similarity defaults to 1.0 for categories missing from
     * {@code similarityScores}.
     */
    public Map<String, Double> weightsFor(Collection<String> categories, Map<String, Double> similarityScores) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String category : categories) {
            double depthScore = 0.5 + Math.min(depth(category) / 10.0, 1.0);
            double similarity = 1.0;
            if (similarityScores != null && similarityScores.get(category) != null) {
                similarity = similarityScores.get(category);
            }
            weights.put(category, depthScore * similarity);
        }
        return weights;
    }

    public Map<String, Double> weightsFor(Collection<String> categories) {
        return weightsFor(categories, null);
    }

    /**
     * Every registered category, parents and children alike.
     */
    public Set<String> categories() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(children.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String category) {
        lock.readLock().lock();
        try {
            return children.containsKey(category);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return children.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Drops memoized depths; the next {@link #depth(String)} call recomputes.
     */
    public void clearDepthCache() {
        lock.writeLock().lock();
        try {
            depthCache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
