package org.javai.experiment.model;

/**
 * Comparison applied by a {@link SegmentCriterion}.
 */
public enum CriterionOperator {
    EQUALS,
    NOT_EQUALS,
    IN,
    NOT_IN,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN,
    EXISTS
}
