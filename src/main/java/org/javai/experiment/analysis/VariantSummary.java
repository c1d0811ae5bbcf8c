package org.javai.experiment.analysis;

import java.util.Map;

import org.javai.experiment.model.RunningAggregate;

/**
 * Descriptive numbers of one variant at analysis time.
 *
 * @param probabilityToBeBest posterior probability this arm is best on the primary goal;
 *                            null unless the method is Bayesian
 */
public record VariantSummary(
        String variantId,
        boolean control,
        long exposures,
        Map<String, Long> conversions,
        Map<String, Double> conversionRates,
        Map<String, RunningAggregate> metrics,
        Double probabilityToBeBest
) {

    public VariantSummary {
        conversions = conversions == null ? Map.of() : Map.copyOf(conversions);
        conversionRates = conversionRates == null ? Map.of() : Map.copyOf(conversionRates);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
