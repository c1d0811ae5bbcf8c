package org.javai.experiment.analysis;

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.javai.experiment.model.Goal;

/**
 * Percentile bootstrap of the difference in means.
 *
 * <p>Continuous goals resample the per-user outcomes of each arm with replacement. For binary
 * goals, resampling n zero/one outcomes with replacement is the same as drawing
 * Binomial(n, p) successes, which is what is done instead. Arms with more exposures than an
 * int can count draw the resampled rate from its normal approximation N(p, p(1-p)/n). The two-sided p-value is twice the
 * smaller share of resampled differences on either side of zero.
 *
 * <p>The interrupt flag is checked on every iteration; a cancelled run throws and keeps nothing.
 */
class BootstrapComparison implements ComparisonMethod {

    private final int iterations;

    BootstrapComparison(int iterations) {
        this.iterations = iterations;
    }

    @Override
    public VariantComparison compare(Goal goal, ArmData control, ArmData treatment, ComparisonContext context)
            throws AnalysisCancelledException {
        double difference = treatment.mean() - control.mean();
        DescriptiveStatistics resampled = new DescriptiveStatistics(iterations);
        Resampler controlSampler = resampler(control, context.random());
        Resampler treatmentSampler = resampler(treatment, context.random());

        long atOrBelowZero = 0;
        long atOrAboveZero = 0;
        for (int i = 0; i < iterations; i++) {
            AnalysisCancelledException.checkInterrupted(context.testId());
            double d = treatmentSampler.mean() - controlSampler.mean();
            resampled.addValue(d);
            if (d <= 0) {
                atOrBelowZero++;
            }
            if (d >= 0) {
                atOrAboveZero++;
            }
        }

        double p = Math.min(1.0, 2.0 * Math.min(atOrBelowZero, atOrAboveZero) / iterations);
        double tail = (1.0 - context.confidenceLevel()) / 2.0 * 100.0;
        Interval interval = new Interval(resampled.getPercentile(Math.max(tail, 1e-9)),
                resampled.getPercentile(100.0 - tail));

        return new VariantComparison(
                goal.goalId(),
                control.variantId(),
                treatment.variantId(),
                control.mean(),
                treatment.mean(),
                difference,
                EffectSize.relativeLift(control.mean(), difference),
                resampled.getStandardDeviation(),
                0.0,
                p,
                p,
                null,
                interval,
                EffectSize.cohensD(control, treatment),
                EffectSize.hedgesG(control, treatment),
                control.sampleSize(),
                treatment.sampleSize(),
                false);
    }

    private static Resampler resampler(ArmData arm, RandomGenerator random) {
        if (arm.sampleSize() == 0) {
            return () -> 0.0;
        }
        if (arm.isBinary()) {
            return binaryResampler(arm, random);
        }
        double[] outcomes = arm.outcomes();
        return () -> {
            double sum = 0.0;
            for (int j = 0; j < outcomes.length; j++) {
                sum += outcomes[random.nextInt(outcomes.length)];
            }
            return sum / outcomes.length;
        };
    }

    private static Resampler binaryResampler(ArmData arm, RandomGenerator random) {
        double p = arm.mean();
        if (p <= 0.0 || p >= 1.0) {
            return () -> p;
        }
        if (arm.sampleSize() > Integer.MAX_VALUE) {
            NormalDistribution rate = new NormalDistribution(random, p, Math.sqrt(arm.varianceOfMean()),
                    NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
            return rate::sample;
        }
        int n = (int) arm.sampleSize();
        BinomialDistribution successes = new BinomialDistribution(random, n, p);
        return () -> (double) successes.sample() / n;
    }

    @FunctionalInterface
    private interface Resampler {
        double mean();
    }
}
