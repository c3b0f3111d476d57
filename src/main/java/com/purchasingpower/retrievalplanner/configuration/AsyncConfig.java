package com.purchasingpower.retrievalplanner.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Async configuration for weight learning.
 *
 * Learning runs after the executor reports results, off the caller's thread.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "learningExecutor")
    public Executor learningExecutor(PlannerProperties properties) {
        PlannerProperties.Learning learning = properties.getLearning();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(learning.getCorePoolSize());
        executor.setMaxPoolSize(learning.getMaxPoolSize());
        executor.setQueueCapacity(learning.getQueueCapacity());
        executor.setThreadNamePrefix("planner-learning-");

        // Pending weight updates are applied before shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Learning executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                learning.getQueueCapacity());

        return executor;
    }
}
