package com.purchasingpower.retrievalplanner.budget;

/**
 * Coarse complexity class of a plan, used to scale its budget.
 */
public enum QueryComplexity {
    LOW(0.7),
    MEDIUM(1.0),
    HIGH(1.5),
    VERY_HIGH(2.0);

    private final double multiplier;

    QueryComplexity(double multiplier) {
        this.multiplier = multiplier;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Score is {@code topK * 0.5 + maxDepth * 2 + edgeTypeCount * 0.3};
     * below 5 is LOW, below 10 MEDIUM, below 20 HIGH.
     */
    public static QueryComplexity estimate(int topK, int maxDepth, int edgeTypeCount) {
        double score = topK * 0.5 + maxDepth * 2.0 + edgeTypeCount * 0.3;
        if (score < 5) {
            return LOW;
        } else if (score < 10) {
            return MEDIUM;
        } else if (score < 20) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}
