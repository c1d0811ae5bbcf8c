package org.javai.experiment.analysis;

import java.util.List;

import org.javai.experiment.model.GoalMetric;

/**
 * All comparisons of one goal, with the verdict they support. Only the primary goal's verdict
 * becomes the verdict of the analysis.
 */
public record GoalResult(
        String goalId,
        boolean primary,
        GoalMetric metric,
        List<VariantComparison> comparisons,
        Verdict verdict,
        String bestVariantId
) {

    public GoalResult {
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
    }
}
