package org.javai.experiment.model.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import org.javai.experiment.model.PropertyValue;

/**
 * A goal completion. {@code value} is 1 for plain conversions.
 */
public record ConversionEvent(
        String eventId,
        String testId,
        String userId,
        String variantId,
        String goalId,
        double value,
        Instant timestamp,
        Map<String, PropertyValue> properties
) implements ExperimentEvent {

    public ConversionEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(goalId, "goalId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
