package org.javai.experiment.ops;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.javai.experiment.Failure;
import org.javai.experiment.FailureId;
import org.javai.experiment.FailureKind;

/**
 * Catches uncaught exceptions (defects) at the top of the stack and reports them to operations.
 *
 * <p>The Boundary lets RuntimeExceptions propagate, since they are defects rather than
 * operational failures. This handler sees them at the thread level, on the engine's own
 * analysis workers, before the thread dies.</p>
 *
 * <pre>{@code
 * ExecutorService pool = Executors.newFixedThreadPool(2, handler.threadFactory("experiment-analysis"));
 * }</pre>
 */
public final class OperationalExceptionHandler implements UncaughtExceptionHandler {

    public static final String DEFECT_NAMESPACE = "defect";

    private final OpReporter reporter;
    private final Clock clock;

    public OperationalExceptionHandler(OpReporter reporter) {
        this(reporter, Clock.systemUTC());
    }

    public OperationalExceptionHandler(OpReporter reporter, Clock clock) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        String operation = "UncaughtException:" + thread.getName();
        String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName();

        FailureKind kind = FailureKind.defect(
                FailureId.of(DEFECT_NAMESPACE, throwable.getClass().getSimpleName()), message);

        Failure failure = new Failure(
                kind,
                throwable,
                operation,
                clock.instant(),
                null,
                Map.of("thread.name", thread.getName(), "thread.id", String.valueOf(thread.getId()))
        );

        reporter.report(failure);
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a named, daemon ThreadFactory that installs this handler on all created threads.
     */
    public ThreadFactory threadFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                thread.setUncaughtExceptionHandler(OperationalExceptionHandler.this);
                return thread;
            }
        };
    }
}
