package com.purchasingpower.retrievalplanner.exception;

import lombok.Getter;

/**
 * Raised when a plan request is missing mandatory input (the query vector).
 * This is the only failure that stops plan production.
 */
@Getter
public class InvalidQueryException extends RuntimeException {

    private final String queryId;

    public InvalidQueryException(String message, String queryId) {
        super(message);
        this.queryId = queryId;
    }
}
