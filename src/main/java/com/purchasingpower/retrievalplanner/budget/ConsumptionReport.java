package com.purchasingpower.retrievalplanner.budget;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Consumption measured against an allocated budget.
 */
@Value
@Builder
public class ConsumptionReport {

    /**
     * Consumed / allocated per resource; 0 where nothing was allocated.
     */
    Map<String, Double> ratios;

    /**
     * Mean of {@link #ratios}.
     */
    double overallRatio;
}
