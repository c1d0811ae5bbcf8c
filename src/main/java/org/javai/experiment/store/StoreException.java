package org.javai.experiment.store;

/**
 * Raised by an {@link ExperimentStore} backend when a read or write could not be completed.
 * Checked, so that every engine call into the store goes through a
 * {@link org.javai.experiment.boundary.Boundary}.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
