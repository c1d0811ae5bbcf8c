package org.javai.experiment.ops;

import org.javai.experiment.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class OperationalExceptionHandlerTest {

    private List<Failure> reportedFailures;
    private OperationalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        reportedFailures = new CopyOnWriteArrayList<>();
        handler = new OperationalExceptionHandler(reportedFailures::add, ExperimentFixtures.clock());
    }

    @Test
    void uncaughtException_reportsDefect() {
        handler.uncaughtException(new Thread(() -> {}), new ArithmeticException("/ by zero"));

        assertThat(reportedFailures).hasSize(1);
        Failure failure = reportedFailures.get(0);
        assertThat(failure.type()).isEqualTo(FailureType.DEFECT);
        assertThat(failure.id()).isEqualTo(FailureId.of("defect", "ArithmeticException"));
        assertThat(failure.message()).isEqualTo("/ by zero");
        assertThat(failure.occurredAt()).isEqualTo(ExperimentFixtures.NOW);
    }

    @Test
    void uncaughtException_includesThreadInfo() {
        Thread thread = Thread.currentThread();

        handler.uncaughtException(thread, new IllegalStateException());

        Failure failure = reportedFailures.get(0);
        assertThat(failure.operation()).isEqualTo("UncaughtException:" + thread.getName());
        assertThat(failure.tags())
                .containsEntry("thread.name", thread.getName())
                .containsEntry("thread.id", String.valueOf(thread.getId()));
        assertThat(failure.message()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void threadFactory_namesDaemonThreadsAndInstallsHandler() {
        Thread thread = handler.threadFactory("experiment-analysis").newThread(() -> {});

        assertThat(thread.getName()).isEqualTo("experiment-analysis-1");
        assertThat(thread.isDaemon()).isTrue();
        assertThat(thread.getUncaughtExceptionHandler()).isSameAs(handler);
    }

    @Test
    void executorService_defectOnWorker_isReported() throws InterruptedException {
        CountDownLatch reported = new CountDownLatch(1);
        OperationalExceptionHandler latching = new OperationalExceptionHandler(failure -> {
            reportedFailures.add(failure);
            reported.countDown();
        });
        ExecutorService pool = Executors.newSingleThreadExecutor(latching.threadFactory("worker"));
        try {
            // execute() lets the exception reach the thread's handler; submit() would keep it in the Future
            pool.execute(() -> {
                throw new IllegalStateException("corrupt snapshot");
            });

            assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(reportedFailures.get(0).tags()).containsEntry("thread.name", "worker-1");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void installOn_setsHandler() {
        Thread thread = new Thread(() -> {});

        handler.installOn(thread);

        assertThat(thread.getUncaughtExceptionHandler()).isSameAs(handler);
    }
}
