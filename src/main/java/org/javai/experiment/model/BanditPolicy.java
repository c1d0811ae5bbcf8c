package org.javai.experiment.model;

public enum BanditPolicy {
    EPSILON_GREEDY,
    THOMPSON_SAMPLING,
    UPPER_CONFIDENCE_BOUND
}
