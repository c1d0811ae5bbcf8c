package org.javai.experiment.model;

public enum AnalysisMethod {
    FREQUENTIST,
    BAYESIAN,
    BOOTSTRAP
}
