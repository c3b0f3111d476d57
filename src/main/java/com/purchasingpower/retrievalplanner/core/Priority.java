package com.purchasingpower.retrievalplanner.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller priority of a query. Budgets never shrink as priority rises.
 *
 * @since 1.0.0
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
