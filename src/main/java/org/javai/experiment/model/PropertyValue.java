package org.javai.experiment.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A scalar carried by event properties and user attributes.
 * The closed set keeps aggregation and audience matching well-typed.
 */
public sealed interface PropertyValue
        permits PropertyValue.StringValue, PropertyValue.NumberValue,
                PropertyValue.BooleanValue, PropertyValue.TimestampValue {

    record StringValue(String value) implements PropertyValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record NumberValue(double value) implements PropertyValue {
    }

    record BooleanValue(boolean value) implements PropertyValue {
    }

    record TimestampValue(Instant value) implements PropertyValue {
        public TimestampValue {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    static PropertyValue of(String value) {
        return new StringValue(value);
    }

    static PropertyValue of(double value) {
        return new NumberValue(value);
    }

    static PropertyValue of(boolean value) {
        return new BooleanValue(value);
    }

    static PropertyValue of(Instant value) {
        return new TimestampValue(value);
    }

    /**
     * Numeric view used by ordering comparisons; timestamps compare by epoch millis.
     * Returns NaN for values without a numeric reading.
     */
    default double asNumber() {
        if (this instanceof NumberValue n) {
            return n.value();
        }
        if (this instanceof TimestampValue t) {
            return t.value().toEpochMilli();
        }
        return Double.NaN;
    }

    /**
     * Text view used by {@code CONTAINS}.
     */
    default String asText() {
        if (this instanceof StringValue s) {
            return s.value();
        }
        if (this instanceof NumberValue n) {
            return Double.toString(n.value());
        }
        if (this instanceof BooleanValue b) {
            return Boolean.toString(b.value());
        }
        return ((TimestampValue) this).value().toString();
    }
}
