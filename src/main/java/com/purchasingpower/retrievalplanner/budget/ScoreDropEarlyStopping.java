package com.purchasingpower.retrievalplanner.budget;

import com.purchasingpower.retrievalplanner.core.ExecutionResult;

import java.util.List;

/**
 * Stops once the top results are good enough or scores fall off sharply.
 *
 * <ul>
 *   <li>fewer than 3 results: never stop</li>
 *   <li>over 70% consumed and the top 3 average above 0.85: stop</li>
 *   <li>more than 5 results and the 1st minus the 5th score above 0.3: stop</li>
 * </ul>
 * Unscored results disable the rule that would need their score.
 */
public class ScoreDropEarlyStopping implements EarlyStoppingHeuristic {

    @Override
    public boolean shouldStop(List<ExecutionResult> results, double budgetConsumedRatio) {
        if (results.size() < 3) {
            return false;
        }

        if (budgetConsumedRatio > 0.7) {
            List<ExecutionResult> top = results.subList(0, 3);
            if (top.stream().allMatch(ExecutionResult::hasScore)) {
                double average = top.stream().mapToDouble(ExecutionResult::getScore).average().orElse(0.0);
                if (average > 0.85) {
                    return true;
                }
            }
        }

        if (results.size() > 5 && results.stream().allMatch(ExecutionResult::hasScore)) {
            return results.get(0).getScore() - results.get(4).getScore() > 0.3;
        }
        return false;
    }
}
