package org.javai.experiment.analysis;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.GoalDirection;

/**
 * Bayesian comparison with flat priors.
 *
 * <p>Binary goals get Beta(1 + conversions, 1 + non-conversions) posteriors; the probability
 * that the treatment beats control is integrated numerically (Simpson's rule) and the credible
 * interval of the difference comes from posterior draws. Continuous goals use the normal
 * approximation to the posterior of each mean, which gives both in closed form.
 */
class BayesianComparison implements ComparisonMethod {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);
    static final int INTEGRATION_INTERVALS = 2000;
    private static final int CANCEL_CHECK_EVERY = 1024;

    private final int draws;

    BayesianComparison(int draws) {
        this.draws = draws;
    }

    @Override
    public boolean usesPValues() {
        return false;
    }

    @Override
    public VariantComparison compare(Goal goal, ArmData control, ArmData treatment, ComparisonContext context)
            throws AnalysisCancelledException {
        double difference = treatment.mean() - control.mean();
        double probabilityBetter;
        double se;
        Interval interval;

        if (control.isBinary()) {
            BetaDistribution a = posterior(control, context.random());
            BetaDistribution b = posterior(treatment, context.random());
            double pTreatmentHigher = probabilityGreater(b, a);
            probabilityBetter = goal.direction() == GoalDirection.INCREASE ? pTreatmentHigher : 1.0 - pTreatmentHigher;
            se = Math.sqrt(a.getNumericalVariance() + b.getNumericalVariance());
            interval = drawnInterval(a, b, context);
        } else {
            se = Math.sqrt(control.varianceOfMean() + treatment.varianceOfMean());
            double pTreatmentHigher = se == 0.0
                    ? (difference > 0 ? 1.0 : difference < 0 ? 0.0 : 0.5)
                    : STANDARD_NORMAL.cumulativeProbability(difference / se);
            probabilityBetter = goal.direction() == GoalDirection.INCREASE ? pTreatmentHigher : 1.0 - pTreatmentHigher;
            double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - context.confidenceLevel()) / 2.0);
            interval = Interval.around(difference, z * se);
        }

        return new VariantComparison(
                goal.goalId(),
                control.variantId(),
                treatment.variantId(),
                control.mean(),
                treatment.mean(),
                difference,
                EffectSize.relativeLift(control.mean(), difference),
                se,
                0.0,
                null,
                null,
                probabilityBetter,
                interval,
                EffectSize.cohensD(control, treatment),
                EffectSize.hedgesG(control, treatment),
                control.sampleSize(),
                treatment.sampleSize(),
                false);
    }

    /**
     * Share of joint posterior draws in which each arm is the best, in the goal's direction.
     *
     * @return probabilities in the order of {@code arms}
     */
    double[] probabilityToBeBest(Goal goal, List<ArmData> arms, ComparisonContext context)
            throws AnalysisCancelledException {
        RealDistribution[] posteriors = new RealDistribution[arms.size()];
        for (int i = 0; i < arms.size(); i++) {
            ArmData arm = arms.get(i);
            posteriors[i] = arm.isBinary()
                    ? posterior(arm, context.random())
                    : new NormalDistribution(context.random(), arm.mean(),
                            Math.max(Math.sqrt(arm.varianceOfMean()), 1e-12));
        }
        long[] wins = new long[arms.size()];
        double sign = goal.direction() == GoalDirection.INCREASE ? 1.0 : -1.0;
        for (int d = 0; d < draws; d++) {
            if (d % CANCEL_CHECK_EVERY == 0) {
                AnalysisCancelledException.checkInterrupted(context.testId());
            }
            int best = 0;
            double bestValue = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < posteriors.length; i++) {
                double value = sign * posteriors[i].sample();
                if (value > bestValue) {
                    bestValue = value;
                    best = i;
                }
            }
            wins[best]++;
        }
        return Arrays.stream(wins).mapToDouble(w -> (double) w / draws).toArray();
    }

    static BetaDistribution posterior(ArmData arm, RandomGenerator random) {
        long failures = arm.sampleSize() - arm.successes();
        return new BetaDistribution(random, 1.0 + arm.successes(), 1.0 + failures);
    }

    /**
     * P(X > Y) = integral of f_X(x) F_Y(x) dx, over a window of +-8 standard deviations of X.
     */
    static double probabilityGreater(BetaDistribution x, BetaDistribution y) {
        double sd = Math.sqrt(x.getNumericalVariance());
        double lo = Math.max(0.0, x.getNumericalMean() - 8 * sd);
        double hi = Math.min(1.0, x.getNumericalMean() + 8 * sd);
        if (hi <= lo) {
            return 0.5;
        }
        int n = INTEGRATION_INTERVALS;
        double h = (hi - lo) / n;
        double sum = 0.0;
        for (int i = 0; i <= n; i++) {
            double point = lo + i * h;
            double value = density(x, point) * y.cumulativeProbability(point);
            double coefficient = (i == 0 || i == n) ? 1 : (i % 2 == 1 ? 4 : 2);
            sum += coefficient * value;
        }
        double probability = sum * h / 3.0;
        return Math.max(0.0, Math.min(1.0, probability));
    }

    private static double density(BetaDistribution distribution, double x) {
        double value = distribution.density(x);
        return Double.isFinite(value) ? value : 0.0;
    }

    private Interval drawnInterval(BetaDistribution control, BetaDistribution treatment, ComparisonContext context)
            throws AnalysisCancelledException {
        double[] differences = new double[draws];
        for (int d = 0; d < draws; d++) {
            if (d % CANCEL_CHECK_EVERY == 0) {
                AnalysisCancelledException.checkInterrupted(context.testId());
            }
            differences[d] = treatment.sample() - control.sample();
        }
        Arrays.sort(differences);
        double tail = (1.0 - context.confidenceLevel()) / 2.0;
        return new Interval(quantile(differences, tail), quantile(differences, 1.0 - tail));
    }

    static double quantile(double[] sorted, double q) {
        int index = (int) Math.floor(q * (sorted.length - 1));
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }
}
