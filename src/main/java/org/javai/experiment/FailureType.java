package org.javai.experiment;

/**
 * Classifies failures by their nature and expected behavior.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve if the caller tries again.
     * Examples: store timeout, store temporarily unavailable.
     */
    TRANSIENT,

    /**
     * Failure that will not resolve by repeating the same call.
     * Examples: unknown test, tracking before assignment, starting a running test.
     */
    PERMANENT,

    /**
     * Programming error or misconfiguration.
     * Examples: weights that do not sum to one, a test without a control arm.
     */
    DEFECT
}
