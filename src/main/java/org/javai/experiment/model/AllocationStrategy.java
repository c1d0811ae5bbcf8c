package org.javai.experiment.model;

public enum AllocationStrategy {
    /** Uniform split; configured weights are ignored. */
    EQUAL,
    /** Configured weights. */
    WEIGHTED,
    /** Weights maintained by the bandit optimizer. */
    BANDIT
}
