package org.javai.experiment;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-contextualized failure ready for reporting and for the caller's decision.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type The failure type (TRANSIENT, PERMANENT, DEFECT)
 * @param exception The underlying exception (may be null)
 * @param operation The operation that failed (e.g., "ExperimentEngine.trackConversion")
 * @param occurredAt When the failure happened
 * @param correlationId Trace correlation identifier (may be null)
 * @param tags Additional key-value metadata for observability
 * @param trackingId Stable identifier for metrics aggregation (defaults to operation if null)
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt,
        String correlationId,
        Map<String, String> tags,
        String trackingId
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        trackingId = trackingId == null ? operation : trackingId;
    }

    /**
     * Creates a failure from a classified kind, adding operational context.
     */
    public Failure(FailureKind kind, Throwable exception, String operation, Instant occurredAt,
                   String correlationId, Map<String, String> tags) {
        this(kind.id(), kind.message(), kind.type(), exception, operation, occurredAt,
                correlationId, tags, null);
    }
}
