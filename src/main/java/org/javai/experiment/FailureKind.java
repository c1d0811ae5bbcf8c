package org.javai.experiment;

import java.util.Objects;

/**
 * Describes a failure without operational context.
 * This is what classifiers produce; the Boundary adds context to create a full Failure.
 *
 * @param id Namespaced failure identifier
 * @param message Human-readable description
 * @param type Whether the failure is transient, permanent or a defect
 */
public record FailureKind(FailureId id, String message, FailureType type) {

    public FailureKind {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static FailureKind transientOp(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.TRANSIENT);
    }

    public static FailureKind permanentOp(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.PERMANENT);
    }

    public static FailureKind defect(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.DEFECT);
    }
}
