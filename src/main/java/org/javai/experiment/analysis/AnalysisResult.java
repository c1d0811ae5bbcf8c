package org.javai.experiment.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.javai.experiment.model.AnalysisMethod;

/**
 * Report of one analysis run.
 *
 * @param testId the analysed test
 * @param method inferential method used
 * @param analyzedAt when the analysis ran
 * @param verdict overall verdict, from the primary goal
 * @param winningVariantId winner when the verdict is SIGNIFICANT_WINNER, otherwise null
 * @param recommendation what to do next
 * @param variants per-variant descriptive summary, in definition order
 * @param goals per-goal results, primary first
 * @param power sample-size planning numbers for the primary goal
 * @param look 1-based look number for sequential tests, 0 otherwise
 * @param alphaAtLook significance threshold in force for this analysis
 * @param totalSampleSize exposures across all arms
 */
public record AnalysisResult(
        String testId,
        AnalysisMethod method,
        Instant analyzedAt,
        Verdict verdict,
        String winningVariantId,
        Recommendation recommendation,
        List<VariantSummary> variants,
        List<GoalResult> goals,
        PowerAnalysis power,
        int look,
        double alphaAtLook,
        long totalSampleSize
) {

    public AnalysisResult {
        variants = variants == null ? List.of() : List.copyOf(variants);
        goals = goals == null ? List.of() : List.copyOf(goals);
    }

    public GoalResult primary() {
        return goals.get(0);
    }

    public Optional<String> winner() {
        return Optional.ofNullable(winningVariantId);
    }

    public Optional<VariantComparison> comparison(String goalId, String variantId) {
        return goals.stream()
                .filter(g -> g.goalId().equals(goalId))
                .flatMap(g -> g.comparisons().stream())
                .filter(c -> c.variantId().equals(variantId))
                .findFirst();
    }
}
