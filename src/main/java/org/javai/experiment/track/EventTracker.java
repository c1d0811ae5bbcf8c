package org.javai.experiment.track;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.ExperimentFailures;
import org.javai.experiment.Outcome;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.PropertyValue;
import org.javai.experiment.model.event.ConversionEvent;
import org.javai.experiment.model.event.ExperimentEvent;
import org.javai.experiment.model.event.ExposureEvent;
import org.javai.experiment.model.event.MetricEvent;
import org.javai.experiment.store.ExperimentStore;

/**
 * Records exposure, conversion and metric events against an existing assignment.
 *
 * <p>Every call first resolves the assignment; tracking a user who was never assigned fails
 * with {@code no_assignment} so the caller can decide to assign and track again. Counter updates
 * go through the store's per-assignment and per-variant atomic operations; nothing here takes a
 * lock. An event is appended to the test's log only when it changed a counter.
 */
public class EventTracker {

    private static final Logger LOG = LogManager.getLogger(EventTracker.class);

    public static final double DEFAULT_CONVERSION_VALUE = 1.0;

    private final ExperimentStore store;
    private final Boundary boundary;
    private final Clock clock;

    public EventTracker(ExperimentStore store, Boundary boundary, Clock clock) {
        this.store = store;
        this.boundary = boundary;
        this.clock = clock;
    }

    /**
     * @return true if the exposure was counted, false if it repeated an already counted one
     */
    public Outcome<Boolean> trackExposure(Experiment experiment, String userId, Map<String, PropertyValue> context) {
        String operation = "EventTracker.trackExposure";
        return resolve(operation, experiment, userId).flatMap(assignment ->
                boundary.call("ExperimentStore.recordExposure", tags(experiment),
                        () -> store.recordExposure(assignment, experiment.repeatExposures()))
                        .flatMap(counted -> {
                            if (!counted) {
                                return Outcome.ok(false);
                            }
                            ExposureEvent event = new ExposureEvent(newEventId(), experiment.testId(), userId,
                                    assignment.variantId(), clock.instant(), context);
                            return append(experiment, event).map(v -> true);
                        }));
    }

    /**
     * @param value conversion value; null means {@value #DEFAULT_CONVERSION_VALUE}
     * @return true if the conversion was counted, false if it was a duplicate on a once-only goal
     */
    public Outcome<Boolean> trackConversion(Experiment experiment, String userId, String goalId, Double value,
                                            Map<String, PropertyValue> properties) {
        String operation = "EventTracker.trackConversion";
        Optional<Goal> goal = experiment.goal(goalId);
        if (goal.isEmpty()) {
            return ExperimentFailures.unknownGoal(clock, operation, experiment.testId(), goalId);
        }
        double amount = value != null ? value : DEFAULT_CONVERSION_VALUE;
        requireFinite(amount, "conversion value");
        boolean repeatable = goal.get().repeatConversions();

        return resolve(operation, experiment, userId).flatMap(assignment ->
                boundary.call("ExperimentStore.recordConversion", tags(experiment),
                        () -> store.recordConversion(assignment, goalId, amount, repeatable))
                        .flatMap(counted -> {
                            if (!counted) {
                                LOG.debug("Duplicate conversion of {} on goal {} in test {} ignored",
                                        userId, goalId, experiment.testId());
                                return Outcome.ok(false);
                            }
                            ConversionEvent event = new ConversionEvent(newEventId(), experiment.testId(), userId,
                                    assignment.variantId(), goalId, amount, clock.instant(), properties);
                            return append(experiment, event).map(v -> true);
                        }));
    }

    public Outcome<Void> trackMetric(Experiment experiment, String userId, String metricName, double value,
                                     Map<String, PropertyValue> properties) {
        String operation = "EventTracker.trackMetric";
        requireFinite(value, "metric value");
        return resolve(operation, experiment, userId).flatMap(assignment ->
                boundary.call("ExperimentStore.recordMetric", tags(experiment), () -> {
                            store.recordMetric(assignment, metricName, value);
                            return null;
                        })
                        .flatMap(ignored -> {
                            MetricEvent event = new MetricEvent(newEventId(), experiment.testId(), userId,
                                    assignment.variantId(), metricName, value, clock.instant(), properties);
                            return append(experiment, event);
                        }));
    }

    private Outcome<Assignment> resolve(String operation, Experiment experiment, String userId) {
        if (!experiment.status().acceptsEvents()) {
            return ExperimentFailures.invalidTransition(clock, operation, experiment.testId(),
                    "Test " + experiment.testId() + " is " + experiment.status() + " and does not accept events");
        }
        return boundary.call("ExperimentStore.findAssignment", tags(experiment),
                        () -> store.findAssignment(experiment.testId(), userId))
                .flatMap(found -> found.<Outcome<Assignment>>map(Outcome::ok)
                        .orElseGet(() -> ExperimentFailures.noAssignment(clock, operation, experiment.testId(), userId)));
    }

    private Outcome<Void> append(Experiment experiment, ExperimentEvent event) {
        return boundary.call("ExperimentStore.appendEvent", tags(experiment), () -> {
            store.appendEvent(event);
            return null;
        });
    }

    private static Map<String, String> tags(Experiment experiment) {
        return Map.of("testId", experiment.testId());
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }

    private static void requireFinite(double value, String what) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(what + " must be finite, was " + value);
        }
    }
}
