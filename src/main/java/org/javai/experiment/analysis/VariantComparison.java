package org.javai.experiment.analysis;

/**
 * One treatment measured against control on one goal.
 *
 * @param goalId the goal
 * @param controlId control variant
 * @param variantId treatment variant
 * @param controlMean control rate or mean
 * @param variantMean treatment rate or mean
 * @param difference variantMean - controlMean
 * @param relativeLift difference as a percentage of controlMean (0 when control is 0)
 * @param standardError standard error of the difference
 * @param testStatistic z or t statistic; 0 for Bayesian and bootstrap
 * @param pValue raw two-sided p-value; null for Bayesian
 * @param adjustedPValue p-value after multiple-testing correction; null for Bayesian
 * @param probabilityToBeatControl posterior probability the treatment is better; null unless Bayesian
 * @param interval confidence, credible or percentile interval of the difference
 * @param cohensD standardized effect size
 * @param hedgesG small-sample corrected effect size
 * @param controlSample control sample size
 * @param variantSample treatment sample size
 * @param significant whether the comparison clears the threshold in force
 */
public record VariantComparison(
        String goalId,
        String controlId,
        String variantId,
        double controlMean,
        double variantMean,
        double difference,
        double relativeLift,
        double standardError,
        double testStatistic,
        Double pValue,
        Double adjustedPValue,
        Double probabilityToBeatControl,
        Interval interval,
        double cohensD,
        double hedgesG,
        long controlSample,
        long variantSample,
        boolean significant
) {

    VariantComparison withAdjustedPValue(double adjusted) {
        return new VariantComparison(goalId, controlId, variantId, controlMean, variantMean, difference,
                relativeLift, standardError, testStatistic, pValue, adjusted, probabilityToBeatControl,
                interval, cohensD, hedgesG, controlSample, variantSample, significant);
    }

    VariantComparison withSignificant(boolean flag) {
        return new VariantComparison(goalId, controlId, variantId, controlMean, variantMean, difference,
                relativeLift, standardError, testStatistic, pValue, adjustedPValue, probabilityToBeatControl,
                interval, cohensD, hedgesG, controlSample, variantSample, flag);
    }
}
