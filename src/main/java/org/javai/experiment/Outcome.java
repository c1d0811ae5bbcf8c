package org.javai.experiment;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Represents the outcome of an engine operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Every operation of {@link ExperimentEngine} answers with an Outcome. Expected failures
 * (unknown test, lifecycle violation, tracking before assignment, an unreachable store) are
 * values, not exceptions; only defects propagate as RuntimeExceptions.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     * @param correlationId optional correlation ID for tracing
     */
    record Ok<T>(T value, Optional<String> correlationId) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(correlationId, "correlationId must not be null, use Optional.empty()");
        }

        public Ok(T value) {
            this(value, Optional.empty());
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Outcome<T> correlationId(String correlationId) {
            return new Ok<>(value, Optional.ofNullable(correlationId));
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value), correlationId);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            Outcome<U> result = mapper.apply(value);
            // Preserve correlation ID if the result doesn't have one
            if (correlationId.isPresent() && result.correlationId().isEmpty()) {
                return result.correlationId(correlationId.get());
            }
            return result;
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
     * @param correlationId optional correlation ID for tracing
     */
    record Fail<T>(Failure failure, Optional<String> correlationId) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
            Objects.requireNonNull(correlationId, "correlationId must not be null, use Optional.empty()");
        }

        public Fail(Failure failure) {
            this(failure, Optional.empty());
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public Outcome<T> correlationId(String correlationId) {
            return new Fail<>(failure, Optional.ofNullable(correlationId));
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        // The record accessor is failure(); this view keeps the interface symmetric.
        @Override
        public Optional<Failure> failureIfAny() {
            return Optional.of(failure);
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure, correlationId);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure, correlationId);
        }
    }

    boolean isOk();
    boolean isFail();

    /**
     * Returns the correlation ID if present.
     */
    Optional<String> correlationId();

    /**
     * Returns a new Outcome with the specified correlation ID.
     */
    Outcome<T> correlationId(String correlationId);

    T getOrThrow();
    T getOrElse(T defaultValue);

    /**
     * Returns the failure of a failed outcome, or empty for a successful one.
     */
    default Optional<Failure> failureIfAny() {
        return Optional.empty();
    }

    /**
     * Returns true when this outcome failed with the given failure identifier.
     */
    default boolean failedWith(FailureId id) {
        return failureIfAny().map(f -> f.id().equals(id)).orElse(false);
    }

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
