package org.javai.experiment.model;

import java.util.Map;
import java.util.Objects;

/**
 * One arm of a test. Carries only the definition; counters live in the store and are read
 * as {@link VariantStats} snapshots.
 *
 * @param variantId identifier, unique within the test
 * @param name human label
 * @param description what the arm changes
 * @param parameters the parameter/content differences this arm represents
 * @param control whether this arm is the baseline
 */
public record Variant(
        String variantId,
        String name,
        String description,
        Map<String, String> parameters,
        boolean control
) {

    public Variant {
        Objects.requireNonNull(variantId, "variantId must not be null");
        name = name == null ? variantId : name;
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static Variant control(String variantId) {
        return new Variant(variantId, variantId, null, Map.of(), true);
    }

    public static Variant treatment(String variantId) {
        return new Variant(variantId, variantId, null, Map.of(), false);
    }

    public static Variant treatment(String variantId, Map<String, String> parameters) {
        return new Variant(variantId, variantId, null, parameters, false);
    }
}
