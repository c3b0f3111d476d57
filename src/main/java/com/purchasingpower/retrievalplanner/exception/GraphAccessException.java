package com.purchasingpower.retrievalplanner.exception;

import lombok.Getter;

/**
 * Thrown by {@link com.purchasingpower.retrievalplanner.core.GraphDataAccess}
 * implementations when an entity or relationship lookup fails.
 */
@Getter
public class GraphAccessException extends RuntimeException {

    private final String operation;

    public GraphAccessException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public GraphAccessException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }
}
