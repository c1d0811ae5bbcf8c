package org.javai.experiment.analysis;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.javai.experiment.model.SequentialBoundaries;
import org.javai.experiment.model.SpendingFunction;

/**
 * Lan-DeMets alpha spending for repeated looks at a sequential test.
 *
 * <p>With information fraction {@code t = min(1, look / plannedLooks)}, look {@code k} may spend
 * {@code alpha(t_k) - alpha(t_{k-1})}. The increments sum to the full alpha at the last planned
 * look; looks past the plan spend nothing.
 */
public final class AlphaSpending {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private AlphaSpending() {
    }

    /**
     * Alpha spent up to information fraction {@code t}.
     */
    public static double cumulative(SpendingFunction function, double alpha, double t) {
        if (t <= 0) {
            return 0.0;
        }
        double fraction = Math.min(1.0, t);
        return switch (function) {
            case OBRIEN_FLEMING -> {
                double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - alpha / 2.0);
                yield 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(z / Math.sqrt(fraction)));
            }
            case POCOCK -> alpha * Math.log(1.0 + (Math.E - 1.0) * fraction);
        };
    }

    /**
     * Significance threshold of the given 1-based look.
     */
    public static double thresholdForLook(SequentialBoundaries boundaries, double alpha, int look) {
        if (look < 1) {
            throw new IllegalArgumentException("look must be 1-based, was " + look);
        }
        int planned = boundaries.plannedLooks();
        double current = cumulative(boundaries.spending(), alpha, (double) look / planned);
        double previous = cumulative(boundaries.spending(), alpha, (double) (look - 1) / planned);
        return Math.max(0.0, current - previous);
    }
}
