package org.javai.experiment.analysis;

/**
 * A closed interval, used for confidence, credible and bootstrap percentile intervals.
 */
public record Interval(double lower, double upper) {

    public Interval {
        if (lower > upper) {
            throw new IllegalArgumentException("lower " + lower + " > upper " + upper);
        }
    }

    public static Interval around(double center, double halfWidth) {
        return new Interval(center - halfWidth, center + halfWidth);
    }

    public boolean contains(double x) {
        return x >= lower && x <= upper;
    }

    public boolean within(double bound) {
        return lower >= -bound && upper <= bound;
    }
}
