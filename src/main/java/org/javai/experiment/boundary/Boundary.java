package org.javai.experiment.boundary;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.javai.experiment.Failure;
import org.javai.experiment.FailureKind;
import org.javai.experiment.Outcome;
import org.javai.experiment.ops.OpReporter;

/**
 * The boundary adapter between the engine and its storage collaborator.
 * Catches checked exceptions, classifies them into failures, reports them, and returns Outcome.
 *
 * <p>This is the single point where store exceptions are translated into the Outcome world.
 * After passing through a Boundary, engine code operates entirely in outcome-space, so a slow
 * or failing backend surfaces to the caller as a failed operation and never as a hang.</p>
 *
 * <p>RuntimeExceptions (defects) are not caught. They propagate up to be handled by
 * {@link org.javai.experiment.ops.OperationalExceptionHandler} at the top of the stack.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(reporter);
 *
 * Outcome<Optional<Experiment>> result = boundary.call(
 *     "ExperimentStore.findExperiment",
 *     () -> store.findExperiment(testId)
 * );
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new StoreFailureClassifier();

    private final FailureClassifier classifier;
    private final OpReporter reporter;
    private final Supplier<String> correlationIdSupplier;
    private final Clock clock;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    /**
     * Creates a Boundary with default classification that stamps failures from {@code clock}.
     */
    public static Boundary withReporter(OpReporter reporter, Clock clock) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter, () -> null, clock);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this(classifier, reporter, () -> null);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter, Supplier<String> correlationIdSupplier) {
        this(classifier, reporter, correlationIdSupplier, Clock.systemUTC());
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter, Supplier<String> correlationIdSupplier,
                    Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * The clock that stamps failures crossing this boundary.
     */
    public Clock clock() {
        return clock;
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Executes work with additional tags for observability.
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Map<String, String> tags, Exception e) {
        FailureKind kind = classifier.classify(operation, e);

        Failure failure = new Failure(
                kind,
                e,
                operation,
                clock.instant(),
                correlationIdSupplier.get(),
                tags
        );

        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
