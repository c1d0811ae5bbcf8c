package org.javai.experiment.model;

import java.util.Objects;

/**
 * Per-variant progress on one goal.
 *
 * @param goalId the goal
 * @param conversions distinct assignments that converted
 * @param values aggregate of every recorded conversion value, repeats included
 */
public record GoalStats(String goalId, long conversions, RunningAggregate values) {

    public GoalStats {
        Objects.requireNonNull(goalId, "goalId must not be null");
        values = values == null ? RunningAggregate.EMPTY : values;
    }

    public static GoalStats empty(String goalId) {
        return new GoalStats(goalId, 0, RunningAggregate.EMPTY);
    }
}
