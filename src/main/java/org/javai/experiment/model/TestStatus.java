package org.javai.experiment.model;

/**
 * Lifecycle states of an experiment.
 *
 * <pre>
 * DRAFT -> RUNNING <-> PAUSED
 * RUNNING | PAUSED -> CONCLUDED
 * DRAFT -> ARCHIVED
 * </pre>
 */
public enum TestStatus {
    DRAFT,
    RUNNING,
    PAUSED,
    CONCLUDED,
    ARCHIVED;

    /**
     * Whether exposure, conversion and metric events may still be recorded.
     */
    public boolean acceptsEvents() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Whether variant and goal definitions are frozen.
     */
    public boolean isLocked() {
        return this != DRAFT;
    }
}
