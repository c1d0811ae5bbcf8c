package org.javai.experiment.analysis;

public enum Recommendation {
    /** Roll out the winning variant. */
    LAUNCH,
    /** Keep collecting data. */
    CONTINUE,
    /** Stop the test; the treatments do not matter. */
    STOP;

    static Recommendation forVerdict(Verdict verdict) {
        return switch (verdict) {
            case SIGNIFICANT_WINNER -> LAUNCH;
            case NO_DIFFERENCE -> STOP;
            case INSUFFICIENT_DATA, INCONCLUSIVE -> CONTINUE;
        };
    }
}
