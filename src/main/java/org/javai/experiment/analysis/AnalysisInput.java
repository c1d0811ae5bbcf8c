package org.javai.experiment.analysis;

import java.util.Map;
import java.util.Objects;

import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.VariantStats;

/**
 * A read snapshot handed to the analyzer. The analyzer never touches the store.
 *
 * @param experiment the test, with its looks already counted for sequential tests
 * @param stats variant id to counter snapshot
 * @param userOutcomes goal id to (variant id to per-user totals), for continuous goals
 * @param look 1-based look number for sequential tests, 0 otherwise
 */
public record AnalysisInput(
        Experiment experiment,
        Map<String, VariantStats> stats,
        Map<String, Map<String, double[]>> userOutcomes,
        int look
) {

    public AnalysisInput {
        Objects.requireNonNull(experiment, "experiment must not be null");
        stats = stats == null ? Map.of() : Map.copyOf(stats);
        userOutcomes = userOutcomes == null ? Map.of() : Map.copyOf(userOutcomes);
    }

    VariantStats stats(String variantId) {
        return stats.getOrDefault(variantId, VariantStats.empty(variantId));
    }

    double[] outcomes(String goalId, String variantId) {
        Map<String, double[]> perVariant = userOutcomes.get(goalId);
        double[] values = perVariant == null ? null : perVariant.get(variantId);
        return values == null ? new double[0] : values;
    }
}
