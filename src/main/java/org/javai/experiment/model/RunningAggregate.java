package org.javai.experiment.model;

/**
 * Count, sum and sum of squares of a stream of values. Enough to recover mean and variance
 * without keeping the values.
 */
public record RunningAggregate(long count, double sum, double sumOfSquares) {

    public static final RunningAggregate EMPTY = new RunningAggregate(0, 0.0, 0.0);

    public RunningAggregate add(double value) {
        return new RunningAggregate(count + 1, sum + value, sumOfSquares + value * value);
    }

    public double mean() {
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Unbiased sample variance; zero below two observations.
     */
    public double variance() {
        if (count < 2) {
            return 0.0;
        }
        double mean = mean();
        double v = (sumOfSquares - count * mean * mean) / (count - 1);
        return Math.max(0.0, v);
    }

    public double standardDeviation() {
        return Math.sqrt(variance());
    }
}
