package org.javai.experiment.model.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import org.javai.experiment.model.PropertyValue;

/**
 * An auxiliary measurement (latency, engagement) that does not gate the decision.
 */
public record MetricEvent(
        String eventId,
        String testId,
        String userId,
        String variantId,
        String metricName,
        double value,
        Instant timestamp,
        Map<String, PropertyValue> properties
) implements ExperimentEvent {

    public MetricEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
