package com.purchasingpower.retrievalplanner.rewrite;

import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.retrievalplanner.model.retrieval.TraversalStrategy;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Query-intent templates, tried in declaration order. The first template
 * whose pattern is found in the lowercased query text wins.
 */
public enum PatternKind {

    /**
     * "information on X", "details about X"
     */
    TOPIC_LOOKUP(
            "(?:about|information|details)\\s+(?:on|about)\\s+([a-z0-9\\s]+)",
            TraversalStrategy.TOPIC_FOCUSED,
            PatternKind::firstGroup),

    /**
     * "compare X and Y", "differences between X vs Y"
     */
    COMPARISON(
            "(?:compare|comparison|differences?|similarities?)\\s+(?:(?:between|of)\\s+)?"
                    + "([a-z0-9\\s]+)\\s+(?:and|vs\\.?|versus)\\s+([a-z0-9\\s]+)",
            TraversalStrategy.COMPARISON,
            m -> List.of(m.group(1).trim(), m.group(2).trim())),

    /**
     * "what is X", "definition of X"
     */
    DEFINITION(
            "(?:what\\s+is|define|definition\\s+of|meaning\\s+of)\\s+([a-z0-9\\s]+)",
            TraversalStrategy.DEFINITION,
            PatternKind::firstGroup),

    /**
     * "causes of X", "impact of X"
     */
    CAUSE_EFFECT(
            "(?:causes?|effects?|impact|influence|results?)\\s+of\\s+([a-z0-9\\s]+)",
            TraversalStrategy.CAUSAL,
            PatternKind::firstGroup),

    /**
     * "list of X", "types of X"
     */
    LIST(
            "(?:list|enumerate|types|kinds|categories|examples)\\s+of\\s+([a-z0-9\\s]+)",
            TraversalStrategy.COLLECTION,
            PatternKind::firstGroup);

    private final Pattern pattern;
    private final TraversalStrategy strategy;
    private final Function<Matcher, List<String>> extractor;

    PatternKind(String regex, TraversalStrategy strategy, Function<Matcher, List<String>> extractor) {
        this.pattern = Pattern.compile(regex);
        this.strategy = strategy;
        this.extractor = extractor;
    }

    public TraversalStrategy getStrategy() {
        return strategy;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Entities named by this template in {@code lowercaseText}, or
     * {@code null} when the template does not occur.
     */
    List<String> extract(String lowercaseText) {
        Matcher matcher = pattern.matcher(lowercaseText);
        if (!matcher.find()) {
            return null;
        }
        return extractor.apply(matcher);
    }

    private static List<String> firstGroup(Matcher matcher) {
        return List.of(matcher.group(1).trim());
    }
}
