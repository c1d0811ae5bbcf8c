package org.javai.experiment.analysis;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Per-analysis inputs shared by every comparison of that analysis.
 *
 * @param testId the analysed test, for cancellation reporting
 * @param confidenceLevel level of the reported interval
 * @param random seeded stream for resampling and posterior draws
 */
record ComparisonContext(String testId, double confidenceLevel, RandomGenerator random) {
}
