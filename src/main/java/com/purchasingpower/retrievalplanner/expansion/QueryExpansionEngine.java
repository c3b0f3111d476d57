package com.purchasingpower.retrievalplanner.expansion;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.core.SearchHit;
import com.purchasingpower.retrievalplanner.core.VectorSearch;
import com.purchasingpower.retrievalplanner.exception.ExpansionFailureException;
import com.purchasingpower.retrievalplanner.knowledge.CategoryGraph;
import com.purchasingpower.retrievalplanner.model.retrieval.CategoryExpansion;
import com.purchasingpower.retrievalplanner.model.retrieval.ExpansionResult;
import com.purchasingpower.retrievalplanner.model.retrieval.TopicExpansion;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import com.purchasingpower.retrievalplanner.telemetry.TraceFormatter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Adds related topics and categories to a query before planning.
 *
 * <p>Topics come from the caller's similarity search restricted to hits whose
 * metadata type is "topic". Categories come from token overlap between the
 * query text and category names, widened by one hop in the hierarchy.
 *
 * <p>Expansion never fails: a broken search yields no topics, and the
 * failure is logged and traced.
 */
@Slf4j
public class QueryExpansionEngine {

    static final double CATEGORY_OVERLAP_THRESHOLD = 0.5;
    private static final String TOPIC_TYPE = "topic";
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private final double similarityThreshold;
    private final int maxExpansions;
    private final PlanTracer tracer;

    public QueryExpansionEngine(PlannerProperties properties, PlanTracer tracer) {
        this.similarityThreshold = properties.getExpansion().getSimilarityThreshold();
        this.maxExpansions = properties.getExpansion().getMaxExpansions();
        this.tracer = tracer;
    }

    /**
     * @param vectorSearch similarity search, may be {@code null} to skip topics
     * @param categoryGraph session hierarchy, may be empty
     */
    public ExpansionResult expand(double[] queryVector, String queryText,
                                  VectorSearch vectorSearch, CategoryGraph categoryGraph) {
        List<TopicExpansion> topics = List.of();
        if (vectorSearch != null) {
            try {
                topics = expandTopics(queryVector, vectorSearch, queryText);
            } catch (ExpansionFailureException e) {
                log.warn("Topic expansion failed, continuing without topics: {}", e.getMessage());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("query_text", TraceFormatter.truncate(queryText, 200));
                payload.put("error", e.getCause() != null ? e.getCause().toString() : e.getMessage());
                tracer.logEvent(PlanTracer.EXPANSION_FAILURE, payload);
            }
        }

        List<CategoryExpansion> categories = expandCategories(queryText, categoryGraph);

        ExpansionResult result = ExpansionResult.builder()
                .queryVector(queryVector)
                .queryText(queryText)
                .topics(topics)
                .categories(categories)
                .build();

        log.debug("Expanded query with {} topics and {} categories", topics.size(), categories.size());
        if (result.hasExpansions()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_text", TraceFormatter.truncate(queryText, 200));
            payload.put("topics", topics.stream().map(TopicExpansion::topicId).collect(Collectors.toList()));
            payload.put("categories", categories.stream().map(CategoryExpansion::category).collect(Collectors.toList()));
            tracer.logEvent(PlanTracer.QUERY_EXPANSION, payload);
        }
        return result;
    }

    private List<TopicExpansion> expandTopics(double[] queryVector, VectorSearch vectorSearch, String queryText) {
        List<SearchHit> hits;
        try {
            hits = vectorSearch.search(queryVector, maxExpansions * 2, QueryExpansionEngine::isTopic);
        } catch (RuntimeException e) {
            throw new ExpansionFailureException("Similarity search failed", queryText, e);
        }
        if (hits == null) {
            return List.of();
        }

        // searches are free to ignore the predicate
        return hits.stream()
                .filter(QueryExpansionEngine::isTopic)
                .filter(hit -> hit.getScore() >= similarityThreshold)
                .limit(maxExpansions)
                .map(hit -> new TopicExpansion(hit.getId(), topicName(hit), Math.min(1.0, hit.getScore())))
                .collect(Collectors.toList());
    }

    private static boolean isTopic(SearchHit hit) {
        return hit != null && TOPIC_TYPE.equals(hit.metadataString("type"));
    }

    private static String topicName(SearchHit hit) {
        String name = hit.metadataString("name");
        return name != null && !name.isBlank() ? name : hit.getId();
    }

    private List<CategoryExpansion> expandCategories(String queryText, CategoryGraph categoryGraph) {
        if (queryText == null || categoryGraph == null || categoryGraph.isEmpty()) {
            return List.of();
        }

        Set<String> queryTokens = tokenize(queryText);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        List<String> directMatches = new ArrayList<>();
        for (String category : categoryGraph.categories()) {
            Set<String> categoryTokens = tokenize(category);
            if (categoryTokens.isEmpty()) continue;

            long overlap = categoryTokens.stream().filter(queryTokens::contains).count();
            if (overlap > 0 && (double) overlap / categoryTokens.size() >= CATEGORY_OVERLAP_THRESHOLD) {
                directMatches.add(category);
            }
        }

        Set<String> all = new LinkedHashSet<>(directMatches);
        for (String category : directMatches) {
            categoryGraph.related(category, 1).forEach(entry -> all.add(entry.getKey()));
        }

        return all.stream()
                .map(category -> new CategoryExpansion(category, categoryGraph.depth(category)))
                .sorted(Comparator.comparingInt(CategoryExpansion::depth).reversed())
                .limit(maxExpansions)
                .collect(Collectors.toList());
    }

    static Set<String> tokenize(String text) {
        return Arrays.stream(NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
