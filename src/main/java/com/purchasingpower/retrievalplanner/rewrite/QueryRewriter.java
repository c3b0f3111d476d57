package com.purchasingpower.retrievalplanner.rewrite;

import com.purchasingpower.retrievalplanner.model.retrieval.ExecutionPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.PlanQuery;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalHints;
import com.purchasingpower.retrievalplanner.model.retrieval.VectorSearchParams;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detects the intent of a query and injects strategy-specific hints into
 * its plan.
 *
 * <p>Templates are tried in {@link PatternKind} declaration order:
 * topic lookup, comparison, definition, cause/effect, list.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryRewriter {

    static final List<String> DEFINITION_EDGE_TYPES = List.of("instance_of", "subclass_of", "defined_as");
    static final List<String> CAUSAL_EDGE_TYPES = List.of("causes", "caused_by", "affects", "affected_by");
    static final List<String> COLLECTION_EDGE_TYPES = List.of("instance_of", "subclass_of", "example_of", "has_example");

    private final PlanTracer tracer;

    /**
     * First template found in the text, with the entities it names.
     * Matches whose entities are blank are skipped.
     */
    public Optional<PatternMatch> rewrite(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return Optional.empty();
        }
        String text = queryText.toLowerCase(Locale.ROOT);
        for (PatternKind kind : PatternKind.values()) {
            List<String> entities = kind.extract(text);
            if (entities != null && entities.stream().noneMatch(String::isEmpty)) {
                return Optional.of(new PatternMatch(kind, entities));
            }
        }
        return Optional.empty();
    }

    /**
     * Injects the strategy and traversal preferences of {@code match} into
     * the plan's hints.
     */
    public ExecutionPlan applyHints(ExecutionPlan plan, PatternMatch match) {
        TraversalHints hints = plan.getHints();
        if (hints == null) {
            hints = TraversalHints.builder().build();
            plan.setHints(hints);
        }
        List<String> entities = match.entities();

        hints.setStrategy(match.kind().getStrategy());
        switch (match.kind()) {
            case TOPIC_LOOKUP -> {
                hints.setTargetEntities(new ArrayList<>(entities));
                hints.setPrioritizeRelationships(true);
            }
            case COMPARISON -> {
                hints.setComparisonEntities(new ArrayList<>(entities));
                hints.setFindCommonCategories(true);
                hints.setFindRelationshipsBetween(true);
            }
            case DEFINITION -> hints.setPrioritizeEdgeTypes(new ArrayList<>(DEFINITION_EDGE_TYPES));
            case CAUSE_EFFECT -> hints.setPrioritizeEdgeTypes(new ArrayList<>(CAUSAL_EDGE_TYPES));
            case LIST -> {
                hints.setPrioritizeEdgeTypes(new ArrayList<>(COLLECTION_EDGE_TYPES));
                hints.setCollectionTarget(entities.get(0));
            }
        }
        plan.setDetectedPattern(match.kind().label());
        return plan;
    }

    /**
     * Copies query-level preferences into the plan, then detects a pattern in
     * the query text and applies its hints. A plan without a detected pattern
     * keeps its strategy.
     */
    public Optional<PatternMatch> rewritePlan(ExecutionPlan plan, PlanQuery query) {
        if (query.getCategoryFilter() != null && !query.getCategoryFilter().isEmpty()) {
            VectorSearchParams vectorParams = plan.getVectorParams();
            if (vectorParams == null) {
                vectorParams = VectorSearchParams.builder().build();
                plan.setVectorParams(vectorParams);
            }
            vectorParams.setCategories(new ArrayList<>(query.getCategoryFilter()));
        }

        if (query.isExpandTopics()) {
            if (plan.getHints() == null) {
                plan.setHints(TraversalHints.builder().build());
            }
            plan.getHints().setExpandTopics(true);
            plan.getHints().setTopicExpansionFactor(query.getTopicExpansionFactor());
        }

        Optional<PatternMatch> match = rewrite(query.getQueryText());
        match.ifPresent(m -> {
            applyHints(plan, m);
            log.debug("Detected pattern {} with entities {}", m.kind().label(), m.entities());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_id", query.getQueryId());
            payload.put("pattern", m.kind().label());
            payload.put("entities", m.entities());
            tracer.logEvent(PlanTracer.PATTERN_DETECTED, payload);
        });
        return match;
    }
}
