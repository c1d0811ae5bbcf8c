package org.javai.experiment.model;

public enum GoalDirection {
    INCREASE,
    DECREASE;

    /**
     * Signs a raw difference so that a positive result always means "better".
     */
    public double orient(double difference) {
        return this == INCREASE ? difference : -difference;
    }
}
