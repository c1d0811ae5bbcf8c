package org.javai.experiment.analysis;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * What one arm contributes to one goal's comparison.
 *
 * @param variantId the arm
 * @param sampleSize exposed users
 * @param successes converters (binary goals only)
 * @param mean conversion rate or mean per-user value
 * @param variance per-user variance: p(1-p) for binary goals, the sample variance otherwise
 * @param outcomes per-user values for continuous goals; null for binary goals
 */
public record ArmData(
        String variantId,
        long sampleSize,
        long successes,
        double mean,
        double variance,
        double[] outcomes
) {

    public static ArmData binary(String variantId, long exposures, long conversions) {
        double p = exposures == 0 ? 0.0 : (double) conversions / exposures;
        return new ArmData(variantId, exposures, conversions, p, p * (1 - p), null);
    }

    public static ArmData continuous(String variantId, double[] outcomes) {
        SummaryStatistics summary = new SummaryStatistics();
        for (double outcome : outcomes) {
            summary.addValue(outcome);
        }
        double variance = summary.getN() < 2 ? 0.0 : summary.getVariance();
        double mean = summary.getN() == 0 ? 0.0 : summary.getMean();
        return new ArmData(variantId, summary.getN(), 0, mean, variance, outcomes);
    }

    public boolean isBinary() {
        return outcomes == null;
    }

    /**
     * Variance of the arm's mean.
     */
    double varianceOfMean() {
        return sampleSize == 0 ? 0.0 : variance / sampleSize;
    }
}
