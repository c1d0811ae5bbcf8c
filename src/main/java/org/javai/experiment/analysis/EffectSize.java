package org.javai.experiment.analysis;

/**
 * Standardized effect sizes of a two-arm difference.
 */
final class EffectSize {

    private EffectSize() {
    }

    static double cohensD(ArmData control, ArmData treatment) {
        double pooled = pooledStandardDeviation(control, treatment);
        return pooled == 0.0 ? 0.0 : (treatment.mean() - control.mean()) / pooled;
    }

    /**
     * Cohen's d with the small-sample bias correction {@code 1 - 3 / (4(n1 + n2) - 9)}.
     */
    static double hedgesG(ArmData control, ArmData treatment) {
        long n = control.sampleSize() + treatment.sampleSize();
        if (n < 3) {
            return 0.0;
        }
        return cohensD(control, treatment) * (1.0 - 3.0 / (4.0 * n - 9.0));
    }

    static double relativeLift(double controlMean, double difference) {
        return controlMean == 0.0 ? 0.0 : difference / controlMean * 100.0;
    }

    private static double pooledStandardDeviation(ArmData control, ArmData treatment) {
        if (control.isBinary()) {
            return Math.sqrt((control.variance() + treatment.variance()) / 2.0);
        }
        long nA = control.sampleSize();
        long nB = treatment.sampleSize();
        if (nA + nB <= 2) {
            return 0.0;
        }
        return Math.sqrt(((nA - 1) * control.variance() + (nB - 1) * treatment.variance()) / (nA + nB - 2));
    }
}
