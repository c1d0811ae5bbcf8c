package org.javai.experiment.analysis;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.javai.experiment.model.Goal;

/**
 * Two-proportion z-test for binary goals, Welch's t-test for continuous goals.
 * Both report a two-sided p-value and an unpooled interval of the difference.
 */
class FrequentistComparison implements ComparisonMethod {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    @Override
    public VariantComparison compare(Goal goal, ArmData control, ArmData treatment, ComparisonContext context) {
        return control.isBinary()
                ? twoProportion(goal, control, treatment, context.confidenceLevel())
                : welch(goal, control, treatment, context.confidenceLevel());
    }

    private VariantComparison twoProportion(Goal goal, ArmData control, ArmData treatment, double confidence) {
        long nA = control.sampleSize();
        long nB = treatment.sampleSize();
        double difference = treatment.mean() - control.mean();

        double z = 0.0;
        double p = 1.0;
        if (nA > 0 && nB > 0) {
            double pooled = (double) (control.successes() + treatment.successes()) / (nA + nB);
            double pooledSe = Math.sqrt(pooled * (1 - pooled) * (1.0 / nA + 1.0 / nB));
            if (pooledSe > 0) {
                z = difference / pooledSe;
                p = twoSidedNormal(z);
            }
        }
        double se = Math.sqrt(control.varianceOfMean() + treatment.varianceOfMean());
        Interval interval = Interval.around(difference, criticalValue(confidence) * se);
        return comparison(goal, control, treatment, difference, se, z, p, interval);
    }

    private VariantComparison welch(Goal goal, ArmData control, ArmData treatment, double confidence) {
        long nA = control.sampleSize();
        long nB = treatment.sampleSize();
        double difference = treatment.mean() - control.mean();
        double varA = control.varianceOfMean();
        double varB = treatment.varianceOfMean();
        double se = Math.sqrt(varA + varB);

        if (nA < 2 || nB < 2) {
            return comparison(goal, control, treatment, difference, se, 0.0, 1.0, Interval.around(difference, 0.0));
        }
        if (se == 0.0) {
            // Both arms constant: any difference at all is certain.
            double p = difference == 0.0 ? 1.0 : 0.0;
            return comparison(goal, control, treatment, difference, 0.0, 0.0, p, Interval.around(difference, 0.0));
        }

        double t = difference / se;
        double df = (varA + varB) * (varA + varB)
                / (varA * varA / (nA - 1) + varB * varB / (nB - 1));
        TDistribution distribution = new TDistribution(df);
        double p = 2.0 * (1.0 - distribution.cumulativeProbability(Math.abs(t)));
        double critical = distribution.inverseCumulativeProbability(1.0 - (1.0 - confidence) / 2.0);
        return comparison(goal, control, treatment, difference, se, t, p, Interval.around(difference, critical * se));
    }

    private static VariantComparison comparison(Goal goal, ArmData control, ArmData treatment, double difference,
                                                double se, double statistic, double p, Interval interval) {
        return new VariantComparison(
                goal.goalId(),
                control.variantId(),
                treatment.variantId(),
                control.mean(),
                treatment.mean(),
                difference,
                EffectSize.relativeLift(control.mean(), difference),
                se,
                statistic,
                clamp(p),
                clamp(p),
                null,
                interval,
                EffectSize.cohensD(control, treatment),
                EffectSize.hedgesG(control, treatment),
                control.sampleSize(),
                treatment.sampleSize(),
                false);
    }

    static double twoSidedNormal(double z) {
        return 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z)));
    }

    static double criticalValue(double confidence) {
        return STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - confidence) / 2.0);
    }

    private static double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
