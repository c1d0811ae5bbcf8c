package org.javai.experiment.model.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import org.javai.experiment.model.PropertyValue;

public record ExposureEvent(
        String eventId,
        String testId,
        String userId,
        String variantId,
        Instant timestamp,
        Map<String, PropertyValue> properties
) implements ExperimentEvent {

    public ExposureEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
