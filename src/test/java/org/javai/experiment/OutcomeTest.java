package org.javai.experiment;

import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    private static final Clock CLOCK = ExperimentFixtures.clock();

    @Test
    void ok_minimalOk() {
        Outcome<Void> outcome = Outcome.ok();

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(((Outcome.Ok<Void>) outcome).value()).isNull();
    }

    @Test
    void ok_getOrThrow_returnsValue() {
        Outcome<String> outcome = Outcome.ok("B");

        assertThat(outcome.getOrThrow()).isEqualTo("B");
        assertThat(outcome.getOrElse("A")).isEqualTo("B");
        assertThat(outcome.failureIfAny()).isEmpty();
    }

    @Test
    void fail_getOrThrow_carriesFailure() {
        Outcome<String> outcome = ExperimentFailures.notFound(CLOCK, "ExperimentEngine.getTest", "checkout");

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .hasMessageContaining("experiment:not_found")
                .hasMessageContaining("checkout")
                .extracting(e -> ((OutcomeFailedException) e).failure().type())
                .isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void fail_getOrElse_returnsDefault() {
        Outcome<String> outcome = ExperimentFailures.noAssignment(CLOCK, "op", "checkout", "user-1");

        assertThat(outcome.getOrElse("none")).isEqualTo("none");
    }

    @Test
    void ok_map_transformsValue() {
        Outcome<Integer> mapped = Outcome.ok("variant-B").map(String::length);

        assertThat(mapped.getOrThrow()).isEqualTo(9);
    }

    @Test
    void fail_mapAndFlatMap_propagateFailure() {
        Outcome<String> outcome = ExperimentFailures.unknownGoal(CLOCK, "op", "checkout", "revenue");

        Outcome<Integer> mapped = outcome.map(String::length);
        Outcome<Integer> flatMapped = outcome.flatMap(s -> Outcome.ok(s.length()));

        assertThat(mapped.failedWith(ExperimentFailures.UNKNOWN_GOAL)).isTrue();
        assertThat(flatMapped.failedWith(ExperimentFailures.UNKNOWN_GOAL)).isTrue();
    }

    @Test
    void ok_flatMap_canReturnFailure() {
        Outcome<Integer> result = Outcome.ok("checkout")
                .flatMap(id -> ExperimentFailures.<Integer>invalidTransition(CLOCK, "op", id, "Test checkout is DRAFT"));

        assertThat(result.isFail()).isTrue();
        assertThat(result.failedWith(ExperimentFailures.INVALID_TRANSITION)).isTrue();
    }

    @Test
    void ok_flatMap_preservesCorrelationId() {
        Outcome<String> outcome = Outcome.ok("checkout").correlationId("req-17");

        Outcome<Integer> result = outcome.flatMap(s -> Outcome.ok(s.length()));

        assertThat(result.correlationId()).contains("req-17");
    }

    @Test
    void failedWith_otherId_isFalse() {
        Outcome<String> outcome = ExperimentFailures.notFound(CLOCK, "op", "checkout");

        assertThat(outcome.failedWith(ExperimentFailures.NO_ASSIGNMENT)).isFalse();
        assertThat(Outcome.ok("x").failedWith(ExperimentFailures.NOT_FOUND)).isFalse();
    }

    @Test
    void experimentFailures_tagTheTestAndPickTheType() {
        Failure notFound = ExperimentFailures.notFound(CLOCK, "op", "checkout").failureIfAny().orElseThrow();
        Failure invalid = ExperimentFailures.invalidConfiguration(CLOCK, "op", "no control").failureIfAny().orElseThrow();
        Failure cancelled = ExperimentFailures.analysisCancelled(CLOCK, "op", "checkout").failureIfAny().orElseThrow();

        assertThat(notFound.tags()).containsEntry("testId", "checkout");
        assertThat(notFound.occurredAt()).isEqualTo(ExperimentFixtures.NOW);
        assertThat(invalid.type()).isEqualTo(FailureType.DEFECT);
        assertThat(cancelled.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(cancelled.id().toString()).isEqualTo("experiment:analysis_cancelled");
    }

    @Test
    void failureId_rejectsBlankParts() {
        assertThatThrownBy(() -> FailureId.of(" ", "timeout")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FailureId.of("store", "")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failure_trackingIdDefaultsToOperation() {
        Failure failure = new Failure(FailureId.of("store", "timeout"), "slow", FailureType.TRANSIENT, null,
                "ExperimentStore.variantStats", ExperimentFixtures.NOW, null, null, null);

        assertThat(failure.trackingId()).isEqualTo("ExperimentStore.variantStats");
        assertThat(failure.tags()).isEmpty();
    }
}
