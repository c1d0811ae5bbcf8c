package org.javai.experiment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weight distribution across variants, plus the share of eligible traffic that enters the test.
 *
 * @param strategy how the weights are interpreted
 * @param weights variant id to weight; weights sum to 1
 * @param rolloutPercentage share of eligible users entering the test, in (0, 100]
 * @param banditPolicy reallocation rule for bandit tests (may be null for other tests)
 * @param explorationRate exploration floor per arm for bandit tests; null uses the engine default
 */
public record TrafficAllocation(
        AllocationStrategy strategy,
        Map<String, Double> weights,
        double rolloutPercentage,
        BanditPolicy banditPolicy,
        Double explorationRate
) {

    public TrafficAllocation {
        Objects.requireNonNull(strategy, "strategy must not be null");
        weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static TrafficAllocation weighted(Map<String, Double> weights) {
        return new TrafficAllocation(AllocationStrategy.WEIGHTED, weights, 100.0, null, null);
    }

    public static TrafficAllocation equal(List<String> variantIds) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String id : variantIds) {
            weights.put(id, 1.0 / variantIds.size());
        }
        return new TrafficAllocation(AllocationStrategy.EQUAL, weights, 100.0, null, null);
    }

    public static TrafficAllocation bandit(Map<String, Double> initialWeights, BanditPolicy policy, Double explorationRate) {
        return new TrafficAllocation(AllocationStrategy.BANDIT, initialWeights, 100.0, policy, explorationRate);
    }

    public TrafficAllocation withRollout(double percentage) {
        return new TrafficAllocation(strategy, weights, percentage, banditPolicy, explorationRate);
    }

    public TrafficAllocation withWeights(Map<String, Double> updated) {
        return new TrafficAllocation(strategy, updated, rolloutPercentage, banditPolicy, explorationRate);
    }

    /**
     * Weights in variant definition order. EQUAL ignores the configured weights.
     */
    public double[] weightsInOrder(List<Variant> variants) {
        double[] result = new double[variants.size()];
        for (int i = 0; i < variants.size(); i++) {
            result[i] = strategy == AllocationStrategy.EQUAL
                    ? 1.0 / variants.size()
                    : weights.getOrDefault(variants.get(i).variantId(), 0.0);
        }
        return result;
    }

    public double totalWeight() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
