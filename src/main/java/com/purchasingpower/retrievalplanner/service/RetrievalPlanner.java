package com.purchasingpower.retrievalplanner.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.retrievalplanner.budget.BudgetAllocator;
import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.core.EntitySnapshot;
import com.purchasingpower.retrievalplanner.core.GraphDataAccess;
import com.purchasingpower.retrievalplanner.core.GraphType;
import com.purchasingpower.retrievalplanner.core.Priority;
import com.purchasingpower.retrievalplanner.core.VectorSearch;
import com.purchasingpower.retrievalplanner.exception.GraphAccessException;
import com.purchasingpower.retrievalplanner.exception.InvalidQueryException;
import com.purchasingpower.retrievalplanner.expansion.QueryExpansionEngine;
import com.purchasingpower.retrievalplanner.knowledge.CategoryGraph;
import com.purchasingpower.retrievalplanner.knowledge.GraphTypeDetector;
import com.purchasingpower.retrievalplanner.model.retrieval.Budget;
import com.purchasingpower.retrievalplanner.model.retrieval.EntitySeed;
import com.purchasingpower.retrievalplanner.model.retrieval.ExecutionPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.ExpansionResult;
import com.purchasingpower.retrievalplanner.model.retrieval.PlanQuery;
import com.purchasingpower.retrievalplanner.model.retrieval.PlanWeights;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalHints;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalPlan;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalStrategy;
import com.purchasingpower.retrievalplanner.model.retrieval.VectorSearchParams;
import com.purchasingpower.retrievalplanner.rewrite.QueryRewriter;
import com.purchasingpower.retrievalplanner.scoring.BaseQueryOptimizer;
import com.purchasingpower.retrievalplanner.scoring.EntityImportanceModel;
import com.purchasingpower.retrievalplanner.scoring.OptimizedParameters;
import com.purchasingpower.retrievalplanner.telemetry.MetricsCollector;
import com.purchasingpower.retrievalplanner.telemetry.PhaseTimer;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import com.purchasingpower.retrievalplanner.traversal.TraversalPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * RetrievalPlanner - composes one hybrid vector/graph execution plan.
 *
 * Composition order is fixed:
 * 1. base weighting (adaptive top-k and depth)
 * 2. query expansion, when the query has text
 * 3. pattern detection and hint injection
 * 4. traversal planning and entity seeding, when the graph has data
 * 5. budget allocation
 * 6. metrics and trace emission
 *
 * Only a missing query vector stops planning. Every other step degrades:
 * a failing graph is planned as an empty one, a failing expansion or rewrite
 * leaves the plan without its contribution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalPlanner {

    private final PlannerProperties properties;
    private final CategoryGraph categoryGraph;
    private final GraphTypeDetector graphTypeDetector;
    private final BaseQueryOptimizer baseOptimizer;
    private final QueryExpansionEngine expansionEngine;
    private final QueryRewriter queryRewriter;
    private final TraversalPlanner traversalPlanner;
    private final BudgetAllocator budgetAllocator;
    private final PlanTracer tracer;
    private final MetricsCollector metricsCollector;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionPlan plan(PlanQuery query, GraphDataAccess dataAccess) {
        return plan(query, dataAccess, null);
    }

    /**
     * Plan a query.
     *
     * @param query planning request; its vector is mandatory
     * @param dataAccess graph capability, {@code null} for no graph
     * @param vectorSearch similarity search for topic expansion, may be {@code null}
     * @return composed plan, never {@code null}
     * @throws InvalidQueryException when the query vector is missing or empty
     */
    public ExecutionPlan plan(PlanQuery query, GraphDataAccess dataAccess, VectorSearch vectorSearch) {
        if (query == null || query.getQueryVector() == null || query.getQueryVector().length == 0) {
            String queryId = query != null ? query.getQueryId() : null;
            log.error("Rejecting query {}: no query vector supplied", queryId);
            throw new InvalidQueryException("A query vector is required to plan retrieval", queryId);
        }
        GraphDataAccess graph = dataAccess != null ? dataAccess : GraphDataAccess.none();
        PhaseTimer timer = new PhaseTimer();

        log.info("🧠 Planning retrieval for query {}", query.getQueryId());

        GraphSample sample = sampleGraph(graph);
        GraphType graphType = graphTypeDetector.detect(
                sample.declaredType, sample.entities, sample.relationshipTypes);
        List<String> edgeTypes = resolveEdgeTypes(query, sample);
        timer.mark("graph_sampling");

        // 1. Base weighting
        OptimizedParameters params = baseOptimizer.optimize(query, edgeTypes);
        timer.mark("base_weighting");

        // 2. Expansion
        ExpansionResult expansion = null;
        if (query.hasText()) {
            expansion = expand(query, vectorSearch);
        }
        timer.mark("expansion");

        ExecutionPlan plan = ExecutionPlan.builder()
                .queryId(query.getQueryId())
                .vectorParams(VectorSearchParams.builder()
                        .topK(params.getTopK())
                        .minScore(params.getMinSimilarity())
                        .build())
                .hints(TraversalHints.builder()
                        .strategy(baseStrategy(graphType))
                        .build())
                .weights(PlanWeights.builder()
                        .vector(params.getVectorWeight())
                        .graph(params.getGraphWeight())
                        .hierarchicalBonus(graphType == GraphType.FLAT_LINK ? 0.0 : properties.getHierarchicalBonus())
                        .build())
                .expansion(expansion)
                .graphType(graphType)
                .build();

        // 3. Rewriting
        try {
            queryRewriter.rewritePlan(plan, query);
        } catch (RuntimeException e) {
            log.warn("Query rewriting failed for {}, keeping base strategy: {}", query.getQueryId(), e.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_id", query.getQueryId());
            payload.put("error", e.getMessage());
            tracer.logEvent(PlanTracer.REWRITE_FAILURE, payload);
        }
        timer.mark("rewriting");

        // 4. Traversal planning
        if (sample.hasGraphData()) {
            int nodeBudget = query.getNodeBudget() != null
                    ? query.getNodeBudget()
                    : properties.getBudget().getMaxNodes();
            plan.setTraversal(traversalPlanner.plan(
                    edgeTypes, Math.max(0, params.getMaxTraversalDepth()), Math.max(0, nodeBudget),
                    plan.getHints().getPrioritizeEdgeTypes()));
            try {
                plan.setEntitySeeds(seedEntities(sample.entities));
            } catch (RuntimeException e) {
                log.warn("Entity ranking failed for {}, planning without seeds: {}", query.getQueryId(), e.getMessage());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("operation", "rank_entities");
                payload.put("error", e.getMessage());
                tracer.logEvent(PlanTracer.GRAPH_ACCESS_FAILURE, payload);
            }
        } else {
            log.debug("No graph data for query {}, planning vector-only", query.getQueryId());
            plan.setTraversal(TraversalPlan.empty());
            plan.getHints().setStrategy(TraversalStrategy.VECTOR_ONLY);
        }
        timer.mark("traversal_planning");

        // 5. Budget
        Priority priority = query.getPriority() != null ? query.getPriority() : Priority.NORMAL;
        Budget budget = budgetAllocator.allocate(plan, priority);
        plan.setBudget(budget);
        timer.mark("budget_allocation");

        // 6. Metrics and trace
        emitTelemetry(plan, query, timer);

        log.info("📋 Plan ready for query {}: strategy={}, {} edge types, pattern={}",
                query.getQueryId(), plan.getHints().getStrategy(),
                plan.getTraversal().getEdgeTypes().size(), plan.getDetectedPattern());
        return plan;
    }

    /**
     * Plan as a nested key-value document for handoff or logging.
     */
    public Map<String, Object> toDocument(ExecutionPlan plan) {
        return objectMapper.convertValue(plan, new TypeReference<Map<String, Object>>() {});
    }

    private GraphSample sampleGraph(GraphDataAccess graph) {
        GraphSample sample = new GraphSample();
        try {
            sample.declaredType = graph.getDeclaredGraphType().orElse(null);
            sample.entities = graph.getEntities(properties.getEntities().getSampleSize()).stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            sample.relationshipTypes = graph.getRelationshipTypes().stream()
                    .filter(type -> type != null && !type.isBlank())
                    .collect(Collectors.toCollection(TreeSet::new));
        } catch (RuntimeException e) {
            GraphAccessException failure = e instanceof GraphAccessException
                    ? (GraphAccessException) e
                    : new GraphAccessException("sample_graph", "Graph sampling failed: " + e, e);
            log.warn("Graph sampling failed during '{}', planning without graph data: {}",
                    failure.getOperation(), failure.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operation", failure.getOperation());
            payload.put("error", failure.getMessage());
            tracer.logEvent(PlanTracer.GRAPH_ACCESS_FAILURE, payload);
            return new GraphSample();
        }
        return sample;
    }

    private List<String> resolveEdgeTypes(PlanQuery query, GraphSample sample) {
        if (query.getEdgeTypes() != null && !query.getEdgeTypes().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(query.getEdgeTypes()));
        }
        if (!sample.relationshipTypes.isEmpty()) {
            return new ArrayList<>(sample.relationshipTypes);
        }
        if (sample.hasGraphData()) {
            return new ArrayList<>(properties.getDefaultEdgeTypes());
        }
        return List.of();
    }

    private ExpansionResult expand(PlanQuery query, VectorSearch vectorSearch) {
        try {
            return expansionEngine.expand(query.getQueryVector(), query.getQueryText(), vectorSearch, categoryGraph);
        } catch (RuntimeException e) {
            log.warn("Query expansion failed for {}: {}", query.getQueryId(), e.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_id", query.getQueryId());
            payload.put("error", e.getMessage());
            tracer.logEvent(PlanTracer.EXPANSION_FAILURE, payload);
            return ExpansionResult.empty(query.getQueryVector(), query.getQueryText());
        }
    }

    private static TraversalStrategy baseStrategy(GraphType graphType) {
        return graphType == GraphType.HIERARCHICAL ? TraversalStrategy.HIERARCHICAL : TraversalStrategy.STANDARD;
    }

    private List<EntitySeed> seedEntities(List<EntitySnapshot> entities) {
        if (entities.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> categories = new LinkedHashSet<>();
        entities.forEach(entity -> categories.addAll(entity.getCategories()));
        Map<String, Double> categoryWeights = categoryGraph.weightsFor(categories);

        EntityImportanceModel model = new EntityImportanceModel(clock, tracer);
        List<EntitySeed> seeds = new ArrayList<>();
        for (EntitySnapshot entity : model.rank(entities, categoryWeights)) {
            if (seeds.size() >= properties.getEntities().getTopK()) break;
            if (entity.getId() == null) continue;
            seeds.add(new EntitySeed(entity.getId(), model.score(entity, categoryWeights)));
        }
        return seeds;
    }

    private void emitTelemetry(ExecutionPlan plan, PlanQuery query, PhaseTimer timer) {
        if (properties.isMetricsEnabled()) {
            try {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("query_id", query.getQueryId());
                params.put("top_k", plan.getVectorParams().getTopK());
                params.put("max_depth", plan.getTraversal().getMaxDepth());
                params.put("edge_types", plan.getTraversal().getEdgeTypes());
                params.put("priority", query.getPriority());
                String planId = metricsCollector.startTracking(params);
                plan.setPlanId(planId);
                timer.getPhases().forEach((phase, duration) -> metricsCollector.recordPhase(planId, phase, duration));
            } catch (RuntimeException e) {
                log.warn("Metrics tracking failed for query {}: {}", query.getQueryId(), e.getMessage());
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("plan_id", plan.getPlanId());
        payload.put("query_id", query.getQueryId());
        payload.put("graph_type", plan.getGraphType().label());
        payload.put("strategy", plan.getHints().getStrategy().label());
        payload.put("pattern", plan.getDetectedPattern());
        payload.put("planning_ms", timer.totalMillis());
        tracer.logEvent(PlanTracer.PLAN_CREATED, payload);
    }

    private static final class GraphSample {
        private String declaredType;
        private List<EntitySnapshot> entities = new ArrayList<>();
        private Set<String> relationshipTypes = new TreeSet<>();

        private boolean hasGraphData() {
            return !entities.isEmpty() || !relationshipTypes.isEmpty();
        }
    }
}
