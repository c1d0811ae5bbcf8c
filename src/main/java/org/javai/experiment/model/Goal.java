package org.javai.experiment.model;

import java.util.Objects;

/**
 * A success metric of a test.
 *
 * @param goalId identifier, unique within the test
 * @param name human label
 * @param metric binary conversion or continuous value
 * @param direction which way is better
 * @param weight share of a combined decision metric; informational unless a combination rule is configured
 * @param repeatConversions whether one user may convert more than once (revenue-style goals)
 * @param minimumDetectableEffect smallest absolute effect worth detecting, on the goal's own scale
 * @param expectedBaseline expected control rate or mean, used by power analysis (may be null)
 */
public record Goal(
        String goalId,
        String name,
        GoalMetric metric,
        GoalDirection direction,
        double weight,
        boolean repeatConversions,
        double minimumDetectableEffect,
        Double expectedBaseline
) {

    public Goal {
        Objects.requireNonNull(goalId, "goalId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        name = name == null ? goalId : name;
    }

    /**
     * A once-per-user conversion goal where higher is better.
     */
    public static Goal conversion(String goalId, double minimumDetectableEffect) {
        return new Goal(goalId, goalId, GoalMetric.BINARY, GoalDirection.INCREASE, 1.0, false,
                minimumDetectableEffect, null);
    }

    /**
     * A repeatable value goal where higher is better.
     */
    public static Goal value(String goalId, double minimumDetectableEffect) {
        return new Goal(goalId, goalId, GoalMetric.CONTINUOUS, GoalDirection.INCREASE, 1.0, true,
                minimumDetectableEffect, null);
    }

    public Goal withDirection(GoalDirection direction) {
        return new Goal(goalId, name, metric, direction, weight, repeatConversions,
                minimumDetectableEffect, expectedBaseline);
    }

    public Goal withExpectedBaseline(double baseline) {
        return new Goal(goalId, name, metric, direction, weight, repeatConversions,
                minimumDetectableEffect, baseline);
    }
}
