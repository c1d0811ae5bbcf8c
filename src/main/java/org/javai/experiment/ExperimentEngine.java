package org.javai.experiment;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.analysis.AnalysisCancelledException;
import org.javai.experiment.analysis.AnalysisInput;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.analysis.StatisticalAnalyzer;
import org.javai.experiment.assign.AssignmentEngine;
import org.javai.experiment.bandit.BanditOptimizer;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.boundary.StoreFailureClassifier;
import org.javai.experiment.lifecycle.ConfigurationValidator;
import org.javai.experiment.lifecycle.ExperimentLifecycleController;
import org.javai.experiment.lifecycle.ExperimentUpdater;
import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.DeviceInfo;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.ExperimentConfig;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.GoalMetric;
import org.javai.experiment.model.PropertyValue;
import org.javai.experiment.model.SessionInfo;
import org.javai.experiment.model.TestStatus;
import org.javai.experiment.model.TestType;
import org.javai.experiment.model.TrafficAllocation;
import org.javai.experiment.model.UserProfile;
import org.javai.experiment.model.Variant;
import org.javai.experiment.model.VariantStats;
import org.javai.experiment.ops.OpReporter;
import org.javai.experiment.ops.OperationalExceptionHandler;
import org.javai.experiment.ops.log4j.Log4jOpReporter;
import org.javai.experiment.store.ExperimentStore;
import org.javai.experiment.store.InMemoryExperimentStore;
import org.javai.experiment.track.EventTracker;

/**
 * Entry point of the experimentation engine.
 *
 * <p>Every operation answers with an {@link Outcome}. Expected failures (unknown test, lifecycle
 * violation, tracking before assignment, store trouble) come back as {@link Outcome.Fail};
 * statistical insufficiency is a verdict of a successful analysis, never a failure.
 *
 * <pre>{@code
 * ExperimentEngine engine = ExperimentEngine.builder()
 *     .store(new InMemoryExperimentStore())
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * Experiment test = engine.createTest(config).getOrThrow();
 * engine.startTest(test.testId());
 * Optional<String> variant = engine.assignUserToVariant(test.testId(), userId, profile, session, device)
 *     .getOrElse(Optional.empty());
 * }</pre>
 */
public final class ExperimentEngine implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ExperimentEngine.class);

    private final ExperimentStore store;
    private final Boundary boundary;
    private final OpReporter reporter;
    private final ExperimentUpdater updater;
    private final ExperimentLifecycleController lifecycle;
    private final AssignmentEngine assignments;
    private final EventTracker tracker;
    private final StatisticalAnalyzer analyzer;
    private final BanditOptimizer bandit;
    private final ExecutorService analysisPool;

    private ExperimentEngine(Builder b) {
        this.store = b.store;
        this.reporter = b.reporter;
        this.boundary = new Boundary(new StoreFailureClassifier(), b.reporter, b.correlationIdSupplier, b.clock);
        this.updater = new ExperimentUpdater(store, boundary);
        this.lifecycle = new ExperimentLifecycleController(store, boundary,
                new ConfigurationValidator(b.settings.weightTolerance(), b.settings.explorationFloor()),
                reporter, b.clock);
        this.assignments = new AssignmentEngine(store, boundary, b.clock);
        this.tracker = new EventTracker(store, boundary, b.clock);
        this.analyzer = new StatisticalAnalyzer(b.settings, b.clock);
        this.bandit = new BanditOptimizer(store, boundary, reporter, b.settings);
        OperationalExceptionHandler handler = new OperationalExceptionHandler(reporter, b.clock);
        this.analysisPool = Executors.newFixedThreadPool(b.settings.analysisThreads(),
                handler.threadFactory("experiment-analysis"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Outcome<Experiment> createTest(ExperimentConfig config) {
        return lifecycle.createTest(config);
    }

    public Outcome<Experiment> createTest(String testId, ExperimentConfig config) {
        return lifecycle.createTest(testId, config);
    }

    public Outcome<Boolean> startTest(String testId) {
        return lifecycle.startTest(testId);
    }

    public Outcome<Boolean> pauseTest(String testId) {
        return lifecycle.pauseTest(testId);
    }

    public Outcome<Boolean> resumeTest(String testId) {
        return lifecycle.resumeTest(testId);
    }

    public Outcome<Boolean> stopTest(String testId) {
        return lifecycle.stopTest(testId);
    }

    public Outcome<Boolean> archiveTest(String testId) {
        return lifecycle.archiveTest(testId);
    }

    public Outcome<Optional<Experiment>> getTest(String testId) {
        return lifecycle.getTest(testId);
    }

    public Outcome<List<Experiment>> getTests() {
        return lifecycle.getTests();
    }

    public Outcome<List<Assignment>> getUserExperiments(String userId) {
        return lifecycle.getUserExperiments(userId);
    }

    /**
     * @return the variant id, or empty when the test is not running or the user is not
     *         eligible; fails with {@code not_found} for an unknown test
     */
    public Outcome<Optional<String>> assignUserToVariant(String testId, String userId, UserProfile profile,
                                                         SessionInfo session, DeviceInfo device) {
        return updater.load("ExperimentEngine.assignUserToVariant", testId)
                .flatMap(experiment -> assignments.assign(experiment, userId, profile, session, device));
    }

    public Outcome<Optional<String>> assignUserToVariant(String testId, String userId) {
        return assignUserToVariant(testId, userId, UserProfile.of(userId), SessionInfo.anonymous(), DeviceInfo.unknown());
    }

    public Outcome<Boolean> trackExposure(String testId, String userId) {
        return trackExposure(testId, userId, Map.of());
    }

    /**
     * @return true if counted; false for a repeated exposure under the once-per-assignment policy
     */
    public Outcome<Boolean> trackExposure(String testId, String userId, Map<String, PropertyValue> context) {
        return updater.load("ExperimentEngine.trackExposure", testId)
                .flatMap(experiment -> tracker.trackExposure(experiment, userId, context));
    }

    public Outcome<Boolean> trackConversion(String testId, String userId, String goalId) {
        return trackConversion(testId, userId, goalId, null, Map.of());
    }

    public Outcome<Boolean> trackConversion(String testId, String userId, String goalId, Double value) {
        return trackConversion(testId, userId, goalId, value, Map.of());
    }

    /**
     * @param value conversion value; null counts as 1
     * @return true if counted; false for a duplicate conversion on a once-only goal
     */
    public Outcome<Boolean> trackConversion(String testId, String userId, String goalId, Double value,
                                            Map<String, PropertyValue> properties) {
        return updater.load("ExperimentEngine.trackConversion", testId)
                .flatMap(experiment -> tracker.trackConversion(experiment, userId, goalId, value, properties));
    }

    public Outcome<Void> trackMetric(String testId, String userId, String metricName, double value) {
        return trackMetric(testId, userId, metricName, value, Map.of());
    }

    public Outcome<Void> trackMetric(String testId, String userId, String metricName, double value,
                                     Map<String, PropertyValue> properties) {
        return updater.load("ExperimentEngine.trackMetric", testId)
                .flatMap(experiment -> tracker.trackMetric(experiment, userId, metricName, value, properties));
    }

    /**
     * Analyses the test from a snapshot of its counters. For sequential tests, one look of the
     * alpha budget is spent and recorded on the test before the numbers are read.
     */
    public Outcome<AnalysisResult> analyzeTest(String testId) {
        String operation = "ExperimentEngine.analyzeTest";
        Outcome<Experiment> loaded = updater.load(operation, testId);
        if (loaded.isFail()) {
            return loaded.map(e -> null);
        }
        Experiment experiment = loaded.getOrThrow();
        if (experiment.status() == TestStatus.DRAFT || experiment.status() == TestStatus.ARCHIVED) {
            return ExperimentFailures.invalidTransition(boundary.clock(), operation, testId,
                    "Test " + testId + " is " + experiment.status() + " and has no data to analyse");
        }

        int look = 0;
        if (experiment.testType() == TestType.SEQUENTIAL) {
            Outcome<Experiment> spent = updater.update(operation, testId, current -> Outcome.ok(current.withLookSpent()))
                    .map(change -> change.current());
            if (spent.isFail()) {
                return spent.map(e -> null);
            }
            experiment = spent.getOrThrow();
            look = experiment.looksSpent();
        }

        Outcome<AnalysisInput> input = snapshot(experiment, look);
        if (input.isFail()) {
            return input.map(i -> null);
        }
        try {
            AnalysisResult result = analyzer.analyze(input.getOrThrow());
            reporter.reportAnalysis(result);
            return Outcome.ok(result);
        } catch (AnalysisCancelledException e) {
            LOG.info("Analysis of {} cancelled", testId);
            Outcome<AnalysisResult> cancelled = ExperimentFailures.analysisCancelled(boundary.clock(), operation, testId);
            cancelled.failureIfAny().ifPresent(reporter::report);
            return cancelled;
        }
    }

    /**
     * Runs {@link #analyzeTest(String)} on the engine's analysis pool. Cancelling the future with
     * interruption aborts resampling and posterior draws; nothing partial is kept.
     */
    public Future<Outcome<AnalysisResult>> analyzeTestAsync(String testId) {
        return analysisPool.submit(() -> analyzeTest(testId));
    }

    public Outcome<TrafficAllocation> updateWeights(String testId) {
        return bandit.updateWeights(testId);
    }

    /**
     * Stops the analysis pool, interrupting analyses still in flight.
     */
    @Override
    public void close() {
        analysisPool.shutdownNow();
        try {
            if (!analysisPool.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Analysis workers did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Outcome<AnalysisInput> snapshot(Experiment experiment, int look) {
        String testId = experiment.testId();
        Map<String, String> tags = Map.of("testId", testId);
        Map<String, VariantStats> stats = new LinkedHashMap<>();
        for (Variant variant : experiment.variants()) {
            Outcome<VariantStats> read = boundary.call("ExperimentStore.variantStats", tags,
                    () -> store.variantStats(testId, variant.variantId()));
            if (read.isFail()) {
                return read.map(s -> null);
            }
            stats.put(variant.variantId(), read.getOrThrow());
        }

        Map<String, Map<String, double[]>> outcomes = new HashMap<>();
        for (Goal goal : experiment.goals()) {
            if (goal.metric() != GoalMetric.CONTINUOUS) {
                continue;
            }
            Map<String, double[]> perVariant = new HashMap<>();
            for (Variant variant : experiment.variants()) {
                Outcome<double[]> read = boundary.call("ExperimentStore.userOutcomes", tags,
                        () -> store.userOutcomes(testId, variant.variantId(), goal.goalId()));
                if (read.isFail()) {
                    return read.map(o -> null);
                }
                perVariant.put(variant.variantId(), read.getOrThrow());
            }
            outcomes.put(goal.goalId(), perVariant);
        }
        return Outcome.ok(new AnalysisInput(experiment, stats, outcomes, look));
    }

    /**
     * Builder for {@link ExperimentEngine}. Unset parts default to an in-memory store, a Log4j
     * reporter, settings from the environment and the UTC system clock.
     */
    public static final class Builder {
        private ExperimentStore store = new InMemoryExperimentStore();
        private OpReporter reporter;
        private EngineSettings settings;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> correlationIdSupplier = () -> null;

        private Builder() {}

        public Builder store(ExperimentStore store) {
            this.store = Objects.requireNonNull(store, "store must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder settings(EngineSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder correlationIdSupplier(Supplier<String> correlationIdSupplier) {
            this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier);
            return this;
        }

        public ExperimentEngine build() {
            if (reporter == null) {
                reporter = new Log4jOpReporter();
            }
            if (settings == null) {
                settings = EngineSettings.fromEnvironment();
            }
            return new ExperimentEngine(this);
        }
    }
}
