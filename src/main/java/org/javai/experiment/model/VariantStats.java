package org.javai.experiment.model;

import java.util.Map;
import java.util.Objects;

/**
 * A point-in-time snapshot of one variant's counters.
 *
 * @param variantId the variant
 * @param exposures distinct exposed assignments (all exposures when repeats are allowed)
 * @param goals goal id to goal progress
 * @param metrics metric name to running aggregate
 */
public record VariantStats(
        String variantId,
        long exposures,
        Map<String, GoalStats> goals,
        Map<String, RunningAggregate> metrics
) {

    public VariantStats {
        Objects.requireNonNull(variantId, "variantId must not be null");
        goals = goals == null ? Map.of() : Map.copyOf(goals);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static VariantStats empty(String variantId) {
        return new VariantStats(variantId, 0, Map.of(), Map.of());
    }

    public GoalStats goal(String goalId) {
        return goals.getOrDefault(goalId, GoalStats.empty(goalId));
    }

    public long conversions(String goalId) {
        return goal(goalId).conversions();
    }

    public double conversionRate(String goalId) {
        return exposures == 0 ? 0.0 : (double) conversions(goalId) / exposures;
    }
}
