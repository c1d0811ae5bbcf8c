package org.javai.experiment.lifecycle;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.ExperimentFailures;
import org.javai.experiment.Outcome;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.ExperimentConfig;
import org.javai.experiment.model.TestStatus;
import org.javai.experiment.ops.OpReporter;
import org.javai.experiment.store.ExperimentStore;

/**
 * Creates tests and moves them through their lifecycle.
 *
 * <pre>
 * DRAFT --start--> RUNNING --pause--> PAUSED --resume--> RUNNING
 * RUNNING | PAUSED --stop--> CONCLUDED
 * DRAFT --archive--> ARCHIVED
 * </pre>
 *
 * Every transition is a compare-and-set on the stored experiment, so two concurrent
 * {@code startTest} calls produce exactly one success.
 */
public class ExperimentLifecycleController {

    private static final Logger LOG = LogManager.getLogger(ExperimentLifecycleController.class);

    private final ExperimentStore store;
    private final Boundary boundary;
    private final ExperimentUpdater updater;
    private final ConfigurationValidator validator;
    private final OpReporter reporter;
    private final Clock clock;

    public ExperimentLifecycleController(ExperimentStore store, Boundary boundary, ConfigurationValidator validator,
                                         OpReporter reporter, Clock clock) {
        this.store = store;
        this.boundary = boundary;
        this.updater = new ExperimentUpdater(store, boundary);
        this.validator = validator;
        this.reporter = reporter;
        this.clock = clock;
    }

    public Outcome<Experiment> createTest(ExperimentConfig config) {
        return createTest(UUID.randomUUID().toString(), config);
    }

    /**
     * Validates and stores a new draft test. Nothing is stored when validation fails.
     */
    public Outcome<Experiment> createTest(String testId, ExperimentConfig config) {
        String operation = "ExperimentLifecycleController.createTest";
        List<String> problems = validator.validate(config);
        if (!problems.isEmpty()) {
            LOG.info("Rejected configuration of test {}: {}", config.name(), problems);
            return ExperimentFailures.invalidConfiguration(clock, operation,
                    "Invalid configuration for " + config.name() + ": " + String.join("; ", problems));
        }
        Experiment draft = config.toExperiment(testId, clock.instant());
        return boundary.call("ExperimentStore.insertExperiment", Map.of("testId", testId),
                        () -> store.insertExperiment(draft))
                .flatMap(inserted -> {
                    if (!inserted) {
                        return ExperimentFailures.invalidConfiguration(clock, operation, "Test id already in use: " + testId);
                    }
                    LOG.info("Created test {} ({}) with {} variants", testId, config.name(), config.variants().size());
                    return Outcome.ok(draft);
                });
    }

    /**
     * Activates a draft test, freezing its definition and stamping its activation and planned
     * end times.
     */
    public Outcome<Boolean> startTest(String testId) {
        return transition("ExperimentLifecycleController.startTest", testId, EnumSet.of(TestStatus.DRAFT),
                current -> current.activated(clock.instant()));
    }

    public Outcome<Boolean> pauseTest(String testId) {
        return transition("ExperimentLifecycleController.pauseTest", testId, EnumSet.of(TestStatus.RUNNING),
                current -> current.withStatus(TestStatus.PAUSED));
    }

    public Outcome<Boolean> resumeTest(String testId) {
        return transition("ExperimentLifecycleController.resumeTest", testId, EnumSet.of(TestStatus.PAUSED),
                current -> current.withStatus(TestStatus.RUNNING));
    }

    /**
     * Concludes a running or paused test. Events are rejected from then on; analysis stays available.
     */
    public Outcome<Boolean> stopTest(String testId) {
        return transition("ExperimentLifecycleController.stopTest", testId,
                EnumSet.of(TestStatus.RUNNING, TestStatus.PAUSED),
                current -> current.concluded(clock.instant()));
    }

    /**
     * Scraps a test that was never started.
     */
    public Outcome<Boolean> archiveTest(String testId) {
        return transition("ExperimentLifecycleController.archiveTest", testId, EnumSet.of(TestStatus.DRAFT),
                current -> current.withStatus(TestStatus.ARCHIVED));
    }

    public Outcome<Optional<Experiment>> getTest(String testId) {
        return boundary.call("ExperimentStore.findExperiment", Map.of("testId", testId),
                () -> store.findExperiment(testId));
    }

    public Outcome<List<Experiment>> getTests() {
        return boundary.call("ExperimentStore.listExperiments", store::listExperiments);
    }

    /**
     * All assignments of the user across tests, oldest first.
     */
    public Outcome<List<Assignment>> getUserExperiments(String userId) {
        return boundary.call("ExperimentStore.assignmentsForUser", Map.of("userId", userId),
                () -> store.assignmentsForUser(userId));
    }

    private Outcome<Boolean> transition(String operation, String testId, Set<TestStatus> allowedFrom,
                                        UnaryOperator<Experiment> change) {
        Outcome<VersionedChange> committed = updater.update(operation, testId, current -> {
            if (!allowedFrom.contains(current.status())) {
                return ExperimentFailures.invalidTransition(clock, operation, testId,
                        "Test " + testId + " is " + current.status() + "; expected one of " + allowedFrom);
            }
            return Outcome.ok(change.apply(current));
        });
        return committed.map(versioned -> {
            reporter.reportTransition(versioned.current(), versioned.previous().status());
            return true;
        });
    }
}
