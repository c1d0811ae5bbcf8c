package org.javai.experiment;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.ExperimentConfig;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.GoalStats;
import org.javai.experiment.model.RunningAggregate;
import org.javai.experiment.model.TrafficAllocation;
import org.javai.experiment.model.Variant;
import org.javai.experiment.model.VariantStats;

/**
 * Shared test data: a checkout-button A/B test and helpers to fabricate counter snapshots.
 */
public final class ExperimentFixtures {

    public static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    public static final String GOAL = "signup";

    private ExperimentFixtures() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /**
     * Small resampling budgets keep the suite fast; the seed is the production default.
     */
    public static EngineSettings settings() {
        return EngineSettings.defaults().withBootstrapIterations(500).withBayesianDraws(4000);
    }

    /**
     * Control "A", treatment "B", 50/50, a once-per-user signup goal with an MDE of 2 points.
     */
    public static ExperimentConfig.Builder abConfig(String name) {
        return ExperimentConfig.builder(name)
                .variant(Variant.control("A"))
                .variant(Variant.treatment("B"))
                .allocation(TrafficAllocation.weighted(Map.of("A", 0.5, "B", 0.5)))
                .primaryGoal(Goal.conversion(GOAL, 0.02))
                .minimumSampleSize(100);
    }

    public static Experiment running(ExperimentConfig config, String testId) {
        return config.toExperiment(testId, NOW).activated(NOW);
    }

    public static VariantStats stats(String variantId, long exposures, long conversions) {
        return new VariantStats(variantId, exposures,
                Map.of(GOAL, new GoalStats(GOAL, conversions, new RunningAggregate(conversions, conversions, conversions))),
                Map.of());
    }
}
