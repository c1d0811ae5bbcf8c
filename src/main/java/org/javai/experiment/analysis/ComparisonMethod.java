package org.javai.experiment.analysis;

import org.javai.experiment.model.Goal;

/**
 * Compares one treatment arm with control on one goal.
 * Implementations fill in everything except {@code significant}, which the analyzer decides.
 */
interface ComparisonMethod {

    VariantComparison compare(Goal goal, ArmData control, ArmData treatment, ComparisonContext context)
            throws AnalysisCancelledException;

    /**
     * Whether the method reports p-values, and so takes part in multiple-testing correction and
     * alpha spending.
     */
    default boolean usesPValues() {
        return true;
    }
}
