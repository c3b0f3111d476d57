package com.purchasingpower.retrievalplanner.exception;

import lombok.Getter;

/**
 * Wraps a similarity-search failure during topic expansion.
 * Never leaves the expansion engine; it is logged and traced instead.
 */
@Getter
public class ExpansionFailureException extends RuntimeException {

    private final String queryText;

    public ExpansionFailureException(String message, String queryText, Throwable cause) {
        super(message, cause);
        this.queryText = queryText;
    }
}
