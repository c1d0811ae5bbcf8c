package org.javai.experiment.model.event;

import java.time.Instant;
import java.util.Map;

import org.javai.experiment.model.PropertyValue;

/**
 * An append-only record of something a user did inside a test.
 */
public sealed interface ExperimentEvent permits ExposureEvent, ConversionEvent, MetricEvent {

    String eventId();

    String testId();

    String userId();

    String variantId();

    Instant timestamp();

    Map<String, PropertyValue> properties();
}
