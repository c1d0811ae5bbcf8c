package org.javai.experiment.analysis;

/**
 * Overall decision of an analysis, driven by the primary goal.
 */
public enum Verdict {
    /** Some arm is below the minimum sample size; nothing is declared. */
    INSUFFICIENT_DATA,
    /** Enough data, but neither a winner nor equivalence can be declared yet. */
    INCONCLUSIVE,
    SIGNIFICANT_WINNER,
    /** Every treatment is within the minimum detectable effect of control. */
    NO_DIFFERENCE;

    public boolean isInconclusive() {
        return this == INSUFFICIENT_DATA || this == INCONCLUSIVE;
    }
}
