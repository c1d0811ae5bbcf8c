package org.javai.experiment.model;

/**
 * Lan-DeMets alpha-spending families.
 */
public enum SpendingFunction {
    /** Spends almost nothing early; nearly the full alpha at the last look. */
    OBRIEN_FLEMING,
    /** Spends alpha roughly evenly across looks. */
    POCOCK
}
