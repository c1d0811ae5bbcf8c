package org.javai.experiment.model;

/**
 * The design of an experiment.
 */
public enum TestType {
    SIMPLE_AB,
    MULTIVARIATE,
    /** Traffic weights are rewritten over time by the bandit optimizer. */
    MULTI_ARMED_BANDIT,
    /** Every analysis spends one look of the alpha budget. */
    SEQUENTIAL
}
