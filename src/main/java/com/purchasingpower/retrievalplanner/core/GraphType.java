package com.purchasingpower.retrievalplanner.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Structural family of a knowledge graph.
 *
 * @since 1.0.0
 */
public enum GraphType {
    /**
     * Category/subclass hierarchies (encyclopedic graphs).
     */
    HIERARCHICAL,
    /**
     * Flat link graphs (content-addressed DAGs, reference webs).
     */
    FLAT_LINK,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a declared graph type. Accepts the enum names plus the common
     * aliases "wikipedia" and "ipld"; anything else is UNKNOWN.
     */
    public static GraphType fromDeclared(String declared) {
        if (declared == null || declared.isBlank()) {
            return UNKNOWN;
        }
        String value = declared.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (value) {
            case "hierarchical":
            case "wikipedia":
                return HIERARCHICAL;
            case "flat_link":
            case "flat":
            case "ipld":
                return FLAT_LINK;
            default:
                return UNKNOWN;
        }
    }
}
