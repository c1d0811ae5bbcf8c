package org.javai.experiment.boundary;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.javai.experiment.FailureId;
import org.javai.experiment.FailureKind;
import org.javai.experiment.FailureType;
import org.javai.experiment.store.StoreException;
import org.javai.experiment.store.StoreTimeoutException;

/**
 * Default classifier for failures raised by the storage collaborator.
 * Timeouts and I/O trouble are transient; anything else the backend reports is permanent.
 */
public class StoreFailureClassifier implements FailureClassifier {

    public static final FailureId TIMEOUT = FailureId.of("store", "timeout");
    public static final FailureId UNAVAILABLE = FailureId.of("store", "unavailable");
    public static final FailureId INTERRUPTED = FailureId.of("store", "interrupted");
    public static final FailureId ERROR = FailureId.of("store", "error");

    @Override
    public FailureKind classify(String operation, Throwable t) {
        if (t instanceof StoreTimeoutException timeout) {
            String budget = timeout.budget() != null ? " (budget " + timeout.budget().toMillis() + "ms)" : "";
            return FailureKind.transientOp(TIMEOUT, "Store timeout" + budget + ": " + t.getMessage());
        }

        if (t instanceof TimeoutException) {
            return FailureKind.transientOp(TIMEOUT, "Store timeout: " + t.getMessage());
        }

        if (t instanceof InterruptedException) {
            return FailureKind.transientOp(INTERRUPTED, "Interrupted while waiting for the store");
        }

        // Wrapped I/O from a remote backend
        if (t instanceof IOException || t.getCause() instanceof IOException) {
            return FailureKind.transientOp(UNAVAILABLE, "Store unavailable: " + t.getMessage());
        }

        if (t instanceof StoreException) {
            return FailureKind.permanentOp(ERROR, "Store error: " + t.getMessage());
        }

        return new FailureKind(
                FailureId.of("unknown", t.getClass().getSimpleName()),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName(),
                FailureType.PERMANENT
        );
    }
}
