package org.javai.experiment;

import org.javai.experiment.ops.ConfigResolver;

/**
 * Tunables of the engine, resolved from system properties, then environment variables,
 * then defaults.
 *
 * @param bootstrapIterations resamples per bootstrap comparison
 * @param bayesianDraws Monte Carlo draws for probability-to-be-best
 * @param randomSeed base seed of every random stream the engine uses
 * @param explorationFloor minimum bandit weight per arm when the test does not set one
 * @param weightTolerance allowed deviation of the weight sum from 1
 * @param analysisThreads size of the asynchronous analysis pool
 */
public record EngineSettings(
        int bootstrapIterations,
        int bayesianDraws,
        long randomSeed,
        double explorationFloor,
        double weightTolerance,
        int analysisThreads
) {

    public static final int DEFAULT_BOOTSTRAP_ITERATIONS = 2000;
    public static final int DEFAULT_BAYESIAN_DRAWS = 20000;
    public static final long DEFAULT_RANDOM_SEED = 20240101L;
    public static final double DEFAULT_EXPLORATION_FLOOR = 0.05;
    public static final double DEFAULT_WEIGHT_TOLERANCE = 0.001;
    public static final int DEFAULT_ANALYSIS_THREADS = 2;

    public EngineSettings {
        require(bootstrapIterations > 0, "bootstrapIterations must be positive");
        require(bayesianDraws > 0, "bayesianDraws must be positive");
        require(explorationFloor >= 0 && explorationFloor < 1, "explorationFloor must be in [0, 1)");
        require(weightTolerance >= 0 && weightTolerance < 1, "weightTolerance must be in [0, 1)");
        require(analysisThreads > 0, "analysisThreads must be positive");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_BOOTSTRAP_ITERATIONS, DEFAULT_BAYESIAN_DRAWS, DEFAULT_RANDOM_SEED,
                DEFAULT_EXPLORATION_FLOOR, DEFAULT_WEIGHT_TOLERANCE, DEFAULT_ANALYSIS_THREADS);
    }

    /**
     * @throws IllegalStateException if a configured value is malformed or out of range
     */
    public static EngineSettings fromEnvironment() {
        try {
            return new EngineSettings(
                    ConfigResolver.resolve("experiment.bootstrap.iterations", "EXPERIMENT_BOOTSTRAP_ITERATIONS",
                            DEFAULT_BOOTSTRAP_ITERATIONS, Integer::parseInt),
                    ConfigResolver.resolve("experiment.bayesian.draws", "EXPERIMENT_BAYESIAN_DRAWS",
                            DEFAULT_BAYESIAN_DRAWS, Integer::parseInt),
                    ConfigResolver.resolve("experiment.random.seed", "EXPERIMENT_RANDOM_SEED",
                            DEFAULT_RANDOM_SEED, Long::parseLong),
                    ConfigResolver.resolve("experiment.bandit.exploration-floor", "EXPERIMENT_BANDIT_EXPLORATION_FLOOR",
                            DEFAULT_EXPLORATION_FLOOR, Double::parseDouble),
                    ConfigResolver.resolve("experiment.weight.tolerance", "EXPERIMENT_WEIGHT_TOLERANCE",
                            DEFAULT_WEIGHT_TOLERANCE, Double::parseDouble),
                    ConfigResolver.resolve("experiment.analysis.threads", "EXPERIMENT_ANALYSIS_THREADS",
                            DEFAULT_ANALYSIS_THREADS, Integer::parseInt));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid engine settings: " + e.getMessage(), e);
        }
    }

    public EngineSettings withBootstrapIterations(int iterations) {
        return new EngineSettings(iterations, bayesianDraws, randomSeed, explorationFloor, weightTolerance,
                analysisThreads);
    }

    public EngineSettings withBayesianDraws(int draws) {
        return new EngineSettings(bootstrapIterations, draws, randomSeed, explorationFloor, weightTolerance,
                analysisThreads);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
