package org.javai.experiment.analysis;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import org.javai.experiment.model.MultipleTestingCorrection;

/**
 * Multiple-testing corrections over a family of p-values. Returned values are in input order
 * and capped at 1.
 */
public final class PValueAdjuster {

    private PValueAdjuster() {
    }

    public static double[] adjust(double[] pValues, MultipleTestingCorrection correction) {
        int m = pValues.length;
        if (m <= 1 || correction == MultipleTestingCorrection.NONE) {
            return pValues.clone();
        }
        return switch (correction) {
            case BONFERRONI -> Arrays.stream(pValues).map(p -> Math.min(1.0, p * m)).toArray();
            case HOLM -> holm(pValues);
            case BENJAMINI_HOCHBERG -> benjaminiHochberg(pValues);
            case NONE -> pValues.clone();
        };
    }

    /**
     * Step-down: the i-th smallest p is scaled by (m - i + 1), then made monotone non-decreasing.
     */
    private static double[] holm(double[] p) {
        int m = p.length;
        Integer[] order = ascending(p);
        double[] adjusted = new double[m];
        double running = 0.0;
        for (int rank = 0; rank < m; rank++) {
            int i = order[rank];
            running = Math.max(running, Math.min(1.0, (m - rank) * p[i]));
            adjusted[i] = running;
        }
        return adjusted;
    }

    /**
     * Step-up: the i-th smallest p is scaled by m / i, then made monotone from the largest down.
     */
    private static double[] benjaminiHochberg(double[] p) {
        int m = p.length;
        Integer[] order = ascending(p);
        double[] adjusted = new double[m];
        double running = 1.0;
        for (int rank = m - 1; rank >= 0; rank--) {
            int i = order[rank];
            running = Math.min(running, p[i] * m / (rank + 1));
            adjusted[i] = Math.min(1.0, running);
        }
        return adjusted;
    }

    private static Integer[] ascending(double[] p) {
        return IntStream.range(0, p.length).boxed()
                .sorted(Comparator.comparingDouble(i -> p[i]))
                .toArray(Integer[]::new);
    }
}
