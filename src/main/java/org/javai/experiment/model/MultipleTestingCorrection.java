package org.javai.experiment.model;

public enum MultipleTestingCorrection {
    NONE,
    BONFERRONI,
    HOLM,
    BENJAMINI_HOCHBERG
}
