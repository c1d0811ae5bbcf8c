package org.javai.experiment.model;

/**
 * Shape of a goal's per-user outcome.
 */
public enum GoalMetric {
    /** Converted or not; analysed as a proportion. */
    BINARY,
    /** A value per user (revenue, time on task); analysed as a mean. */
    CONTINUOUS
}
