package org.javai.experiment.analysis;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.GoalDirection;
import org.javai.experiment.model.GoalMetric;

/**
 * Sample-size planning and observed power, both under the normal approximation and a
 * two-sided test.
 */
public final class PowerCalculator {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    /** Baseline rate assumed when neither an expected nor an observed one is available. */
    static final double FALLBACK_BASELINE_RATE = 0.1;

    private PowerCalculator() {
    }

    /**
     * Exposures per arm needed to detect the goal's minimum detectable effect.
     *
     * @param observedControl control arm data, used when the goal has no expected baseline
     * @return 0 when the goal sets no minimum detectable effect
     */
    public static long requiredSampleSizePerArm(Goal goal, ArmData observedControl, double alpha, double power) {
        double mde = goal.minimumDetectableEffect();
        if (mde <= 0) {
            return 0;
        }
        double zAlpha = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - alpha / 2.0);
        double zBeta = STANDARD_NORMAL.inverseCumulativeProbability(power);

        if (goal.metric() == GoalMetric.BINARY) {
            double p1 = baselineRate(goal, observedControl);
            double shift = goal.direction() == GoalDirection.INCREASE ? mde : -mde;
            double p2 = Math.max(1e-6, Math.min(1 - 1e-6, p1 + shift));
            double pBar = (p1 + p2) / 2.0;
            double numerator = zAlpha * Math.sqrt(2 * pBar * (1 - pBar))
                    + zBeta * Math.sqrt(p1 * (1 - p1) + p2 * (1 - p2));
            return (long) Math.ceil(numerator * numerator / ((p2 - p1) * (p2 - p1)));
        }

        double variance = observedControl != null && observedControl.variance() > 0 ? observedControl.variance() : 1.0;
        double z = zAlpha + zBeta;
        return (long) Math.ceil(2.0 * variance * z * z / (mde * mde));
    }

    /**
     * Power of a two-sided test at {@code alpha} against an effect the size of the observed one.
     */
    public static double observedPower(VariantComparison comparison, double alpha) {
        if (comparison.standardError() <= 0 || alpha <= 0) {
            return 0.0;
        }
        double zAlpha = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - alpha / 2.0);
        double shift = Math.abs(comparison.difference()) / comparison.standardError();
        return STANDARD_NORMAL.cumulativeProbability(shift - zAlpha)
                + STANDARD_NORMAL.cumulativeProbability(-shift - zAlpha);
    }

    private static double baselineRate(Goal goal, ArmData observedControl) {
        if (goal.expectedBaseline() != null) {
            return Math.max(1e-6, Math.min(1 - 1e-6, goal.expectedBaseline()));
        }
        if (observedControl != null && observedControl.sampleSize() > 0 && observedControl.mean() > 0) {
            return Math.min(1 - 1e-6, observedControl.mean());
        }
        return FALLBACK_BASELINE_RATE;
    }
}
