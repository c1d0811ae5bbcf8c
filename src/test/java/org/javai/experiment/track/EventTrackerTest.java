package org.javai.experiment.track;

import org.javai.experiment.*;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.boundary.StoreFailureClassifier;
import org.javai.experiment.model.*;
import org.javai.experiment.model.event.ConversionEvent;
import org.javai.experiment.model.event.ExperimentEvent;
import org.javai.experiment.model.event.ExposureEvent;
import org.javai.experiment.model.event.MetricEvent;
import org.javai.experiment.store.FailingExperimentStore;
import org.javai.experiment.store.InMemoryExperimentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class EventTrackerTest {

    private static final String GOAL = ExperimentFixtures.GOAL;

    private InMemoryExperimentStore store;
    private List<Failure> reportedFailures;
    private EventTracker tracker;
    private Experiment experiment;

    @BeforeEach
    void setUp() {
        store = new InMemoryExperimentStore();
        reportedFailures = new ArrayList<>();
        tracker = new EventTracker(store, boundary(), ExperimentFixtures.clock());
        experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .secondaryGoal(Goal.value("revenue", 1.0))
                .build(), "checkout");
        store.insertExperiment(experiment);
        assignTo("u1", "B");
    }

    @Test
    void trackExposure_countsOncePerAssignment() {
        assertThat(tracker.trackExposure(experiment, "u1", Map.of()).getOrThrow()).isTrue();
        assertThat(tracker.trackExposure(experiment, "u1", Map.of()).getOrThrow()).isFalse();

        assertThat(store.variantStats("checkout", "B").exposures()).isEqualTo(1);
        assertThat(store.events("checkout")).hasSize(1).first().isInstanceOf(ExposureEvent.class);
    }

    @Test
    void trackExposure_repeatExposuresAllowed_countsEveryCall() {
        Experiment repeating = ExperimentFixtures.running(ExperimentFixtures.abConfig("feed")
                .repeatExposures(true)
                .build(), "feed");
        store.insertExperiment(repeating);
        store.putAssignmentIfAbsent(new Assignment("feed", "u1", "A", ExperimentFixtures.NOW, null, null, null));

        tracker.trackExposure(repeating, "u1", Map.of());
        tracker.trackExposure(repeating, "u1", Map.of());

        assertThat(store.variantStats("feed", "A").exposures()).isEqualTo(2);
    }

    @Test
    void trackExposure_withoutAssignment_failsNoAssignment() {
        Outcome<Boolean> result = tracker.trackExposure(experiment, "stranger", Map.of());

        assertThat(result.failedWith(ExperimentFailures.NO_ASSIGNMENT)).isTrue();
        assertThat(result.failureIfAny()).get().extracting(Failure::occurredAt).isEqualTo(ExperimentFixtures.NOW);
        assertThat(store.events("checkout")).isEmpty();
    }

    @Test
    void trackConversion_onceOnlyGoal_ignoresDuplicates() {
        tracker.trackExposure(experiment, "u1", Map.of());

        assertThat(tracker.trackConversion(experiment, "u1", GOAL, null, Map.of()).getOrThrow()).isTrue();
        assertThat(tracker.trackConversion(experiment, "u1", GOAL, null, Map.of()).getOrThrow()).isFalse();

        VariantStats stats = store.variantStats("checkout", "B");
        assertThat(stats.conversions(GOAL)).isEqualTo(1);
        assertThat(stats.goal(GOAL).values().sum()).isEqualTo(EventTracker.DEFAULT_CONVERSION_VALUE);
        assertThat(store.events("checkout")).hasSize(2);
    }

    @Test
    void trackConversion_withoutPriorExposure_exposesFirst() {
        tracker.trackConversion(experiment, "u1", GOAL, null, Map.of());

        VariantStats stats = store.variantStats("checkout", "B");
        assertThat(stats.exposures()).isEqualTo(1);
        assertThat(stats.conversions(GOAL)).isEqualTo(1);
        assertThat(tracker.trackExposure(experiment, "u1", Map.of()).getOrThrow()).isFalse();
    }

    @Test
    void trackConversion_repeatableGoal_sumsValuesButCountsConverterOnce() {
        tracker.trackConversion(experiment, "u1", "revenue", 19.99, Map.of());
        tracker.trackConversion(experiment, "u1", "revenue", 5.01, Map.of("sku", PropertyValue.of("mug")));

        GoalStats revenue = store.variantStats("checkout", "B").goal("revenue");
        assertThat(revenue.conversions()).isEqualTo(1);
        assertThat(revenue.values().count()).isEqualTo(2);
        assertThat(revenue.values().sum()).isCloseTo(25.0, within(1e-9));
        assertThat(store.userOutcomes("checkout", "B", "revenue")).containsExactly(new double[]{25.0}, within(1e-9));
    }

    @Test
    void trackConversion_unknownGoal_failsBeforeTouchingStore() {
        Outcome<Boolean> result = tracker.trackConversion(experiment, "stranger", "refund", null, Map.of());

        assertThat(result.failedWith(ExperimentFailures.UNKNOWN_GOAL)).isTrue();
        assertThat(store.events("checkout")).isEmpty();
    }

    @Test
    void trackConversion_nonFiniteValue_isDefect() {
        assertThatThrownBy(() -> tracker.trackConversion(experiment, "u1", "revenue", Double.NaN, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trackConversion_concludedTest_failsInvalidTransition() {
        Experiment concluded = experiment.concluded(ExperimentFixtures.NOW);

        Outcome<Boolean> result = tracker.trackConversion(concluded, "u1", GOAL, null, Map.of());

        assertThat(result.failedWith(ExperimentFailures.INVALID_TRANSITION)).isTrue();
        assertThat(store.variantStats("checkout", "B").conversions(GOAL)).isZero();
    }

    @Test
    void trackConversion_pausedTest_stillCounts() {
        Experiment paused = experiment.withStatus(TestStatus.PAUSED);

        assertThat(tracker.trackConversion(paused, "u1", GOAL, null, Map.of()).getOrThrow()).isTrue();
    }

    @Test
    void trackMetric_aggregatesAndLogsEvent() {
        tracker.trackMetric(experiment, "u1", "latency_ms", 120.0, Map.of());
        tracker.trackMetric(experiment, "u1", "latency_ms", 80.0, Map.of());

        RunningAggregate latency = store.variantStats("checkout", "B").metrics().get("latency_ms");
        assertThat(latency.count()).isEqualTo(2);
        assertThat(latency.mean()).isEqualTo(100.0);
        assertThat(store.events("checkout")).allMatch(e -> e instanceof MetricEvent);
    }

    @Test
    void events_carryVariantAndProperties() {
        tracker.trackConversion(experiment, "u1", GOAL, null, Map.of("page", PropertyValue.of("/cart")));

        ExperimentEvent event = store.events("checkout").get(0);
        assertThat(event).isInstanceOf(ConversionEvent.class);
        assertThat(event.variantId()).isEqualTo("B");
        assertThat(event.timestamp()).isEqualTo(ExperimentFixtures.NOW);
        assertThat(event.properties()).containsEntry("page", PropertyValue.of("/cart"));
    }

    @Test
    void trackExposure_storeTimeout_failsTransiently() throws Exception {
        FailingExperimentStore slow = new FailingExperimentStore();
        slow.insertExperiment(experiment);
        slow.putAssignmentIfAbsent(new Assignment("checkout", "u1", "A", ExperimentFixtures.NOW, null, null, null));
        slow.failOn("recordExposure");
        EventTracker failing = new EventTracker(slow, boundary(),
                ExperimentFixtures.clock());

        Outcome<Boolean> result = failing.trackExposure(experiment, "u1", Map.of());

        assertThat(result.failedWith(StoreFailureClassifier.TIMEOUT)).isTrue();
        assertThat(reportedFailures).extracting(Failure::type).containsExactly(FailureType.TRANSIENT);
        assertThat(slow.heal().events("checkout")).isEmpty();
    }

    @Test
    void concurrentTracking_neverShowsMoreConvertersThanExposures() throws Exception {
        int users = 2000;
        for (int i = 0; i < users; i++) {
            assignTo("user-" + i, i % 2 == 0 ? "A" : "B");
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean();
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int offset = t;
                writers.add(pool.submit(() -> {
                    start.await();
                    for (int i = offset; i < users; i += 8) {
                        String user = "user-" + i;
                        if (i % 3 == 0) {
                            tracker.trackConversion(experiment, user, GOAL, null, Map.of()).getOrThrow();
                        } else {
                            tracker.trackExposure(experiment, user, Map.of()).getOrThrow();
                            tracker.trackConversion(experiment, user, GOAL, null, Map.of()).getOrThrow();
                        }
                    }
                    return null;
                }));
            }
            Future<Boolean> reader = pool.submit(() -> {
                start.await();
                boolean consistent = true;
                while (!done.get()) {
                    for (String variant : List.of("A", "B")) {
                        VariantStats snapshot = store.variantStats("checkout", variant);
                        consistent &= snapshot.conversions(GOAL) <= snapshot.exposures();
                    }
                }
                return consistent;
            });
            start.countDown();
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
            done.set(true);

            assertThat(reader.get(5, TimeUnit.SECONDS)).isTrue();
            long exposures = store.variantStats("checkout", "A").exposures() + store.variantStats("checkout", "B").exposures();
            long conversions = store.variantStats("checkout", "A").conversions(GOAL)
                    + store.variantStats("checkout", "B").conversions(GOAL);
            // u1 is assigned but never tracked here
            assertThat(exposures).isEqualTo(users);
            assertThat(conversions).isEqualTo(users);
        } finally {
            pool.shutdownNow();
        }
    }

    private void assignTo(String userId, String variantId) {
        store.putAssignmentIfAbsent(new Assignment("checkout", userId, variantId, ExperimentFixtures.NOW,
                UserProfile.of(userId), SessionInfo.anonymous(), DeviceInfo.unknown()));
    }

    private Boundary boundary() {
        return Boundary.withReporter(reportedFailures::add, ExperimentFixtures.clock());
    }
}
