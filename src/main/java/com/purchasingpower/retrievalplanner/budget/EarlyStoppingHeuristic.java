package com.purchasingpower.retrievalplanner.budget;

import com.purchasingpower.retrievalplanner.core.ExecutionResult;

import java.util.List;

/**
 * Fallback early-stopping rule consulted when the category-aware rules in
 * {@link BudgetAllocator} do not fire.
 */
@FunctionalInterface
public interface EarlyStoppingHeuristic {

    /**
     * @param results results so far, best first
     * @param budgetConsumedRatio fraction of the budget already used
     */
    boolean shouldStop(List<ExecutionResult> results, double budgetConsumedRatio);
}
