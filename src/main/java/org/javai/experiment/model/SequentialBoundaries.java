package org.javai.experiment.model;

import java.util.Objects;

/**
 * Planned interim analyses of a sequential test.
 *
 * @param plannedLooks number of analyses the alpha budget is spread over
 * @param spending spending function
 */
public record SequentialBoundaries(int plannedLooks, SpendingFunction spending) {

    public SequentialBoundaries {
        Objects.requireNonNull(spending, "spending must not be null");
    }

    public static SequentialBoundaries obrienFleming(int plannedLooks) {
        return new SequentialBoundaries(plannedLooks, SpendingFunction.OBRIEN_FLEMING);
    }
}
