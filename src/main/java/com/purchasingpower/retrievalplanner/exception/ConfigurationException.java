package com.purchasingpower.retrievalplanner.exception;

import lombok.Getter;

/**
 * Malformed planner configuration: weight overrides out of range, negative
 * budgets, thresholds outside [0, 1]. Fatal at construction time.
 */
@Getter
public class ConfigurationException extends RuntimeException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }
}
