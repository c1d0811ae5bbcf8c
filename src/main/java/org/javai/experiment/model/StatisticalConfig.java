package org.javai.experiment.model;

import java.util.Objects;

/**
 * How a test is analysed.
 *
 * @param method inferential method
 * @param significanceThreshold alpha; a comparison is significant when p is below it
 * @param power target power used by sample-size planning
 * @param confidenceLevel level of reported confidence and credible intervals
 * @param correction multiple-testing correction across non-control comparisons
 * @param sequential alpha-spending plan; required for sequential tests, ignored otherwise
 */
public record StatisticalConfig(
        AnalysisMethod method,
        double significanceThreshold,
        double power,
        double confidenceLevel,
        MultipleTestingCorrection correction,
        SequentialBoundaries sequential
) {

    public StatisticalConfig {
        Objects.requireNonNull(method, "method must not be null");
        correction = correction == null ? MultipleTestingCorrection.BENJAMINI_HOCHBERG : correction;
    }

    public static StatisticalConfig defaults() {
        return new StatisticalConfig(AnalysisMethod.FREQUENTIST, 0.05, 0.8, 0.95,
                MultipleTestingCorrection.BENJAMINI_HOCHBERG, null);
    }

    public StatisticalConfig withMethod(AnalysisMethod method) {
        return new StatisticalConfig(method, significanceThreshold, power, confidenceLevel, correction, sequential);
    }

    public StatisticalConfig withCorrection(MultipleTestingCorrection correction) {
        return new StatisticalConfig(method, significanceThreshold, power, confidenceLevel, correction, sequential);
    }

    public StatisticalConfig withSequential(SequentialBoundaries sequential) {
        return new StatisticalConfig(method, significanceThreshold, power, confidenceLevel, correction, sequential);
    }
}
