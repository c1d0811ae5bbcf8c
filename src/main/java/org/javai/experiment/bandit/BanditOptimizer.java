package org.javai.experiment.bandit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.EngineSettings;
import org.javai.experiment.ExperimentFailures;
import org.javai.experiment.Outcome;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.lifecycle.ExperimentUpdater;
import org.javai.experiment.model.AllocationStrategy;
import org.javai.experiment.model.BanditPolicy;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.GoalDirection;
import org.javai.experiment.model.TestType;
import org.javai.experiment.model.TrafficAllocation;
import org.javai.experiment.model.Variant;
import org.javai.experiment.model.VariantStats;
import org.javai.experiment.ops.OpReporter;
import org.javai.experiment.store.ExperimentStore;

/**
 * Recomputes the traffic weights of a bandit test from its running conversion counts.
 *
 * <p>The reward of an arm is the conversion rate on the primary goal, with a Beta(1, 1) prior.
 * A policy turns the arms' rewards into exploitation shares that sum to 1, and the published
 * weight of each arm is {@code floor + (1 - k * floor) * share}: every arm keeps at least the
 * exploration floor however badly it performs.
 * <ul>
 *   <li>{@link BanditPolicy#EPSILON_GREEDY}: the best posterior mean takes the whole share.</li>
 *   <li>{@link BanditPolicy#THOMPSON_SAMPLING}: shares are the Monte Carlo probability of each
 *       arm being best.</li>
 *   <li>{@link BanditPolicy#UPPER_CONFIDENCE_BOUND}: shares are proportional to UCB1 scores;
 *       unplayed arms split the share between them.</li>
 * </ul>
 */
public class BanditOptimizer {

    private static final Logger LOG = LogManager.getLogger(BanditOptimizer.class);

    static final int THOMPSON_DRAWS = 10_000;

    private final ExperimentStore store;
    private final Boundary boundary;
    private final ExperimentUpdater updater;
    private final OpReporter reporter;
    private final EngineSettings settings;

    public BanditOptimizer(ExperimentStore store, Boundary boundary, OpReporter reporter, EngineSettings settings) {
        this.store = store;
        this.boundary = boundary;
        this.updater = new ExperimentUpdater(store, boundary);
        this.reporter = reporter;
        this.settings = settings;
    }

    /**
     * Reads a counter snapshot, computes new weights and writes them to the test. Concurrent
     * tracking is never blocked; the snapshot may lag the latest events by a few increments.
     */
    public Outcome<TrafficAllocation> updateWeights(String testId) {
        String operation = "BanditOptimizer.updateWeights";
        Outcome<Experiment> loaded = updater.load(operation, testId);
        if (loaded.isFail()) {
            return loaded.map(Experiment::allocation);
        }
        Experiment experiment = loaded.getOrThrow();
        if (!isBandit(experiment)) {
            return ExperimentFailures.invalidConfiguration(boundary.clock(), operation, "Test " + testId + " is not a bandit test");
        }
        if (!experiment.status().acceptsEvents()) {
            return ExperimentFailures.invalidTransition(boundary.clock(), operation, testId,
                    "Test " + testId + " is " + experiment.status() + "; weights are frozen");
        }

        Map<String, VariantStats> stats = new LinkedHashMap<>();
        for (Variant variant : experiment.variants()) {
            Outcome<VariantStats> snapshot = boundary.call("ExperimentStore.variantStats", Map.of("testId", testId),
                    () -> store.variantStats(testId, variant.variantId()));
            if (snapshot.isFail()) {
                return snapshot.map(ignored -> experiment.allocation());
            }
            stats.put(variant.variantId(), snapshot.getOrThrow());
        }

        Map<String, Double> weights = computeWeights(experiment, stats);
        return updater.update(operation, testId, current -> Outcome.ok(
                        current.withAllocation(current.allocation().withWeights(weights))))
                .map(change -> {
                    LOG.debug("Bandit test {} now at version {}", testId, change.current().version());
                    reporter.reportWeightsUpdated(testId, weights);
                    return change.current().allocation();
                });
    }

    /**
     * New weights in variant order. Pure apart from the seeded random stream of Thompson sampling.
     */
    public Map<String, Double> computeWeights(Experiment experiment, Map<String, VariantStats> stats) {
        List<Variant> variants = experiment.variants();
        String goalId = experiment.primaryGoal().goalId();
        boolean lowerIsBetter = experiment.primaryGoal().direction() == GoalDirection.DECREASE;
        List<Arm> arms = new ArrayList<>();
        for (Variant variant : variants) {
            VariantStats s = stats.getOrDefault(variant.variantId(), VariantStats.empty(variant.variantId()));
            long successes = s.conversions(goalId);
            long trials = Math.max(s.exposures(), successes);
            arms.add(lowerIsBetter ? new Arm(trials - successes, trials) : new Arm(successes, trials));
        }

        BanditPolicy policy = experiment.allocation().banditPolicy() != null
                ? experiment.allocation().banditPolicy()
                : BanditPolicy.THOMPSON_SAMPLING;
        double[] shares = switch (policy) {
            case EPSILON_GREEDY -> greedyShares(arms);
            case THOMPSON_SAMPLING -> thompsonShares(arms, random(experiment));
            case UPPER_CONFIDENCE_BOUND -> ucbShares(arms);
        };

        double floor = explorationFloor(experiment);
        double exploit = Math.max(0.0, 1.0 - floor * arms.size());
        Map<String, Double> weights = new LinkedHashMap<>();
        for (int i = 0; i < variants.size(); i++) {
            weights.put(variants.get(i).variantId(), floor + exploit * shares[i]);
        }
        return weights;
    }

    double explorationFloor(Experiment experiment) {
        Double configured = experiment.allocation().explorationRate();
        return configured != null ? configured : settings.explorationFloor();
    }

    static double[] greedyShares(List<Arm> arms) {
        double best = arms.stream().mapToDouble(Arm::posteriorMean).max().orElse(0.0);
        long leaders = arms.stream().filter(a -> a.posteriorMean() == best).count();
        return arms.stream().mapToDouble(a -> a.posteriorMean() == best ? 1.0 / leaders : 0.0).toArray();
    }

    static double[] thompsonShares(List<Arm> arms, RandomGenerator random) {
        BetaDistribution[] posteriors = new BetaDistribution[arms.size()];
        for (int i = 0; i < arms.size(); i++) {
            Arm arm = arms.get(i);
            posteriors[i] = new BetaDistribution(random, 1.0 + arm.successes(), 1.0 + arm.trials() - arm.successes());
        }
        long[] wins = new long[arms.size()];
        for (int d = 0; d < THOMPSON_DRAWS; d++) {
            int best = 0;
            double bestDraw = -1.0;
            for (int i = 0; i < posteriors.length; i++) {
                double draw = posteriors[i].sample();
                if (draw > bestDraw) {
                    bestDraw = draw;
                    best = i;
                }
            }
            wins[best]++;
        }
        double[] shares = new double[arms.size()];
        for (int i = 0; i < shares.length; i++) {
            shares[i] = (double) wins[i] / THOMPSON_DRAWS;
        }
        return shares;
    }

    static double[] ucbShares(List<Arm> arms) {
        long unplayed = arms.stream().filter(a -> a.trials() == 0).count();
        double[] shares = new double[arms.size()];
        if (unplayed > 0) {
            for (int i = 0; i < shares.length; i++) {
                shares[i] = arms.get(i).trials() == 0 ? 1.0 / unplayed : 0.0;
            }
            return shares;
        }
        long total = arms.stream().mapToLong(Arm::trials).sum();
        double sum = 0.0;
        for (int i = 0; i < shares.length; i++) {
            Arm arm = arms.get(i);
            shares[i] = arm.rate() + Math.sqrt(2.0 * Math.log(total) / arm.trials());
            sum += shares[i];
        }
        for (int i = 0; i < shares.length; i++) {
            shares[i] = sum > 0 ? shares[i] / sum : 1.0 / shares.length;
        }
        return shares;
    }

    private static boolean isBandit(Experiment experiment) {
        return experiment.testType() == TestType.MULTI_ARMED_BANDIT
                || experiment.allocation().strategy() == AllocationStrategy.BANDIT;
    }

    private RandomGenerator random(Experiment experiment) {
        return new Well19937c(settings.randomSeed() * 31 + experiment.testId().hashCode() + experiment.version());
    }

    /**
     * Successes are conversions, or non-conversions when lower is better.
     */
    record Arm(long successes, long trials) {

        double rate() {
            return trials == 0 ? 0.0 : (double) successes / trials;
        }

        double posteriorMean() {
            return (successes + 1.0) / (trials + 2.0);
        }
    }
}
