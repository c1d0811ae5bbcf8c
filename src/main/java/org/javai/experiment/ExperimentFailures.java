package org.javai.experiment;

import java.time.Clock;
import java.util.Map;

/**
 * The engine's failure vocabulary. Each factory produces a {@link Failure} under the
 * {@code experiment} namespace, tagged with the test it concerns and stamped from the
 * caller's clock.
 */
public final class ExperimentFailures {

    public static final String NAMESPACE = "experiment";

    public static final FailureId INVALID_CONFIGURATION = FailureId.of(NAMESPACE, "invalid_configuration");
    public static final FailureId NOT_FOUND = FailureId.of(NAMESPACE, "not_found");
    public static final FailureId INVALID_TRANSITION = FailureId.of(NAMESPACE, "invalid_transition");
    public static final FailureId NO_ASSIGNMENT = FailureId.of(NAMESPACE, "no_assignment");
    public static final FailureId UNKNOWN_GOAL = FailureId.of(NAMESPACE, "unknown_goal");
    public static final FailureId ANALYSIS_CANCELLED = FailureId.of(NAMESPACE, "analysis_cancelled");

    private ExperimentFailures() {
    }

    public static <T> Outcome<T> invalidConfiguration(Clock clock, String operation, String message) {
        return Outcome.fail(new Failure(INVALID_CONFIGURATION, message, FailureType.DEFECT, null,
                operation, clock.instant(), null, null, null));
    }

    public static <T> Outcome<T> notFound(Clock clock, String operation, String testId) {
        return Outcome.fail(permanent(clock, NOT_FOUND, "Test not found: " + testId, operation, testId));
    }

    public static <T> Outcome<T> invalidTransition(Clock clock, String operation, String testId, String message) {
        return Outcome.fail(permanent(clock, INVALID_TRANSITION, message, operation, testId));
    }

    public static <T> Outcome<T> noAssignment(Clock clock, String operation, String testId, String userId) {
        return Outcome.fail(permanent(clock, NO_ASSIGNMENT,
                "User " + userId + " has no assignment in test " + testId, operation, testId));
    }

    public static <T> Outcome<T> unknownGoal(Clock clock, String operation, String testId, String goalId) {
        return Outcome.fail(permanent(clock, UNKNOWN_GOAL,
                "Goal " + goalId + " is not defined on test " + testId, operation, testId));
    }

    public static <T> Outcome<T> analysisCancelled(Clock clock, String operation, String testId) {
        return Outcome.fail(new Failure(ANALYSIS_CANCELLED, "Analysis of " + testId + " was cancelled",
                FailureType.TRANSIENT, null, operation, clock.instant(), null, Map.of("testId", testId), null));
    }

    private static Failure permanent(Clock clock, FailureId id, String message, String operation, String testId) {
        return new Failure(id, message, FailureType.PERMANENT, null, operation, clock.instant(), null,
                testId == null ? Map.of() : Map.of("testId", testId), null);
    }
}
