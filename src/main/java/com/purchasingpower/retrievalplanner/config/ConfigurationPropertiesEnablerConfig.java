package com.purchasingpower.retrievalplanner.config;

import com.purchasingpower.retrievalplanner.configuration.PlannerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the {@code @ConfigurationProperties} classes of the planner.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link PlannerProperties} - weights, expansion, budget, learning and entity settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    PlannerProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
