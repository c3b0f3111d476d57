package com.purchasingpower.retrievalplanner.config;

import com.purchasingpower.retrievalplanner.budget.BudgetAllocator;
import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import com.purchasingpower.retrievalplanner.expansion.QueryExpansionEngine;
import com.purchasingpower.retrievalplanner.knowledge.CategoryGraph;
import com.purchasingpower.retrievalplanner.knowledge.GraphTypeDetector;
import com.purchasingpower.retrievalplanner.knowledge.RelationshipWeightTable;
import com.purchasingpower.retrievalplanner.learning.LearningFeedbackLoop;
import com.purchasingpower.retrievalplanner.learning.QueryStatistics;
import com.purchasingpower.retrievalplanner.rewrite.QueryRewriter;
import com.purchasingpower.retrievalplanner.scoring.BaseQueryOptimizer;
import com.purchasingpower.retrievalplanner.telemetry.InMemoryMetricsCollector;
import com.purchasingpower.retrievalplanner.telemetry.LoggingPlanTracer;
import com.purchasingpower.retrievalplanner.telemetry.MetricsCollector;
import com.purchasingpower.retrievalplanner.telemetry.PlanTracer;
import com.purchasingpower.retrievalplanner.traversal.TraversalPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the planner components as singletons.
 *
 * <p>The weight table lives for the whole process and the category graph for
 * the session; both are shared by every plan.
 */
@Slf4j
@Configuration
public class PlannerComponentsConfig {

    @Bean
    public Clock plannerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PlanTracer planTracer() {
        return new LoggingPlanTracer();
    }

    @Bean
    public MetricsCollector metricsCollector(Clock clock, PlannerProperties properties) {
        return new InMemoryMetricsCollector(clock, properties.getMetricsMaxHistory());
    }

    @Bean
    public RelationshipWeightTable relationshipWeightTable(PlannerProperties properties) {
        return new RelationshipWeightTable(properties);
    }

    @Bean
    public CategoryGraph categoryGraph() {
        return new CategoryGraph();
    }

    @Bean
    public GraphTypeDetector graphTypeDetector() {
        return new GraphTypeDetector();
    }

    @Bean
    public QueryStatistics queryStatistics(Clock clock) {
        return new QueryStatistics(clock);
    }

    @Bean
    public BaseQueryOptimizer baseQueryOptimizer(QueryStatistics statistics, PlannerProperties properties) {
        return new BaseQueryOptimizer(statistics, properties);
    }

    @Bean
    public QueryExpansionEngine queryExpansionEngine(PlannerProperties properties, PlanTracer tracer) {
        return new QueryExpansionEngine(properties, tracer);
    }

    @Bean
    public QueryRewriter queryRewriter(PlanTracer tracer) {
        return new QueryRewriter(tracer);
    }

    @Bean
    public TraversalPlanner traversalPlanner(RelationshipWeightTable weightTable, PlannerProperties properties) {
        return new TraversalPlanner(weightTable, properties.getHierarchicalWeight());
    }

    @Bean
    public BudgetAllocator budgetAllocator(PlannerProperties properties) {
        return new BudgetAllocator(properties);
    }

    @Bean
    public LearningFeedbackLoop learningFeedbackLoop(RelationshipWeightTable weightTable,
                                                     QueryStatistics statistics,
                                                     PlanTracer tracer,
                                                     PlannerProperties properties,
                                                     @Qualifier("learningExecutor") Executor learningExecutor) {
        log.info("Learning feedback loop enabled: rate={}", properties.getLearning().getRate());
        return new LearningFeedbackLoop(weightTable, statistics, tracer, properties, learningExecutor);
    }
}
