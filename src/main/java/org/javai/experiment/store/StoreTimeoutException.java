package org.javai.experiment.store;

import java.time.Duration;

/**
 * The backend did not answer within its latency budget.
 */
public class StoreTimeoutException extends StoreException {

    private final Duration budget;

    public StoreTimeoutException(String message, Duration budget) {
        super(message);
        this.budget = budget;
    }

    public Duration budget() {
        return budget;
    }
}
