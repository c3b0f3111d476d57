package com.purchasingpower.retrievalplanner.learning;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.core.ExecutionResult;
import com.purchasingpower.retrievalplanner.knowledge.RelationshipWeightTable;
import com.purchasingpower.retrievalplanner.model.retrieval.ExecutionPlan;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adjusts relationship weights from the results an executor reports back.
 *
 * <p>For every edge type seen on a result path, effectiveness is the number
 * of times it occurs divided by the number of results; its weight moves by
 * {@code rate * (effectiveness - 0.5)}, clamped to the weight range. Edge
 * types that were planned but never walked are left alone.
 */
@Slf4j
public class LearningFeedbackLoop {

    private final RelationshipWeightTable weightTable;
    private final QueryStatistics statistics;
    private final PlanTracer tracer;
    private final double learningRate;
    private final Executor learningExecutor;

    public LearningFeedbackLoop(RelationshipWeightTable weightTable,
                                QueryStatistics statistics,
                                PlanTracer tracer,
                                PlannerProperties properties,
                                @Qualifier("learningExecutor") Executor learningExecutor) {
        this.weightTable = weightTable;
        this.statistics = statistics;
        this.tracer = tracer;
        this.learningRate = properties.getLearning().getRate();
        this.learningExecutor = learningExecutor;
    }

    /**
     * Applies one outcome synchronously.
     *
     * @param planUsed plan the executor ran, may be {@code null}
     * @return new weight per adjusted edge type
     */
    public Map<String, Double> recordOutcome(String queryId, List<ExecutionResult> results,
                                             Duration elapsed, ExecutionPlan planUsed) {
        List<ExecutionResult> safeResults = results != null ? results : List.of();
        if (elapsed != null) {
            statistics.recordQueryTime(elapsed.toNanos() / 1_000_000_000.0);
        }

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (ExecutionResult result : safeResults) {
            for (String edgeType : result.getPathEdgeTypes()) {
                if (edgeType != null && !edgeType.isBlank()) {
                    occurrences.merge(RelationshipWeightTable.normalize(edgeType), 1, Integer::sum);
                }
            }
        }

        int resultCount = Math.max(1, safeResults.size());
        Map<String, Double> adjusted = new LinkedHashMap<>();
        occurrences.forEach((edgeType, count) -> {
            double effectiveness = (double) count / resultCount;
            double delta = learningRate * (effectiveness - 0.5);
            adjusted.put(edgeType, weightTable.adjust(edgeType, delta));
        });

        log.info("Learned from query {}: {} results, {} edge types adjusted",
                queryId, safeResults.size(), adjusted.size());

        if (!adjusted.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_id", queryId);
            payload.put("plan_id", planUsed != null ? planUsed.getPlanId() : null);
            payload.put("result_count", safeResults.size());
            payload.put("weights", adjusted);
            tracer.logEvent(PlanTracer.WEIGHTS_ADJUSTED, payload);
        }
        return Collections.unmodifiableMap(adjusted);
    }

    /**
     * Applies one outcome on the learning executor.
     */
    public CompletableFuture<Map<String, Double>> recordOutcomeAsync(String queryId, List<ExecutionResult> results,
                                                                     Duration elapsed, ExecutionPlan planUsed) {
        return CompletableFuture.supplyAsync(
                () -> recordOutcome(queryId, results, elapsed, planUsed), learningExecutor)
                .whenComplete((weights, error) -> {
                    if (error != null) {
                        log.error("Learning from query {} failed: {}", queryId, error.getMessage(), error);
                    }
                });
    }
}
