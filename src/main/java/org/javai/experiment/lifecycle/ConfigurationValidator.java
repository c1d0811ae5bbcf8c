package org.javai.experiment.lifecycle;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.javai.experiment.model.AllocationStrategy;
import org.javai.experiment.model.AudienceSegment;
import org.javai.experiment.model.ExclusionGroup;
import org.javai.experiment.model.ExperimentConfig;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.SegmentCriterion;
import org.javai.experiment.model.StatisticalConfig;
import org.javai.experiment.model.TestType;
import org.javai.experiment.model.TrafficAllocation;
import org.javai.experiment.model.Variant;

/**
 * Checks a test configuration before anything is stored. Returns every problem found, not
 * just the first.
 */
public class ConfigurationValidator {

    private final double weightTolerance;
    private final double defaultExplorationFloor;

    public ConfigurationValidator(double weightTolerance, double defaultExplorationFloor) {
        this.weightTolerance = weightTolerance;
        this.defaultExplorationFloor = defaultExplorationFloor;
    }

    public List<String> validate(ExperimentConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.name().isBlank()) {
            problems.add("name must not be blank");
        }
        checkVariants(config.variants(), problems);
        checkAllocation(config, problems);
        checkGoals(config, problems);
        checkStatistics(config, problems);
        checkAudience(config.audience(), problems);
        if (config.minimumSampleSize() < 0) {
            problems.add("minimum sample size must not be negative");
        }
        if (config.plannedDuration() != null && config.plannedDuration().isNegative()) {
            problems.add("planned duration must not be negative");
        }
        return problems;
    }

    private void checkVariants(List<Variant> variants, List<String> problems) {
        if (variants.size() < 2) {
            problems.add("a test needs at least 2 variants, found " + variants.size());
        }
        long controls = variants.stream().filter(Variant::control).count();
        if (controls != 1) {
            problems.add("exactly one variant must be the control, found " + controls);
        }
        Set<String> ids = new HashSet<>();
        for (Variant variant : variants) {
            if (!ids.add(variant.variantId())) {
                problems.add("duplicate variant id " + variant.variantId());
            }
        }
    }

    private void checkAllocation(ExperimentConfig config, List<String> problems) {
        TrafficAllocation allocation = config.allocation();
        if (allocation == null) {
            problems.add("traffic allocation is required");
            return;
        }
        double rollout = allocation.rolloutPercentage();
        if (!(rollout > 0 && rollout <= 100)) {
            problems.add("rollout percentage must be in (0, 100], was " + rollout);
        }
        if (allocation.strategy() != AllocationStrategy.EQUAL) {
            Map<String, Double> weights = allocation.weights();
            for (Variant variant : config.variants()) {
                if (!weights.containsKey(variant.variantId())) {
                    problems.add("no traffic weight for variant " + variant.variantId());
                }
            }
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                boolean known = config.variants().stream().anyMatch(v -> v.variantId().equals(entry.getKey()));
                if (!known) {
                    problems.add("traffic weight for unknown variant " + entry.getKey());
                }
                Double weight = entry.getValue();
                if (weight == null || !Double.isFinite(weight) || weight < 0) {
                    problems.add("weight of " + entry.getKey() + " must be a non-negative number");
                }
            }
            double total = allocation.totalWeight();
            if (Double.isNaN(total) || Math.abs(total - 1.0) > weightTolerance) {
                problems.add("traffic weights must sum to 1 (+-" + weightTolerance + "), sum is " + total);
            }
        }
        boolean bandit = config.testType() == TestType.MULTI_ARMED_BANDIT
                || allocation.strategy() == AllocationStrategy.BANDIT;
        if (bandit) {
            if (allocation.strategy() == AllocationStrategy.EQUAL) {
                problems.add("a bandit test cannot use EQUAL allocation; its weights are rewritten over time");
            }
            double floor = allocation.explorationRate() != null ? allocation.explorationRate() : defaultExplorationFloor;
            if (!(floor >= 0 && floor < 1)) {
                problems.add("exploration rate must be in [0, 1), was " + floor);
            } else if (floor * config.variants().size() > 1.0 + weightTolerance) {
                problems.add("exploration rate " + floor + " times " + config.variants().size()
                        + " variants exceeds the whole traffic");
            }
        }
    }

    private void checkGoals(ExperimentConfig config, List<String> problems) {
        if (config.primaryGoal() == null) {
            problems.add("a primary goal is required");
            return;
        }
        List<Goal> goals = new ArrayList<>();
        goals.add(config.primaryGoal());
        goals.addAll(config.secondaryGoals());
        Set<String> ids = new HashSet<>();
        for (Goal goal : goals) {
            if (!ids.add(goal.goalId())) {
                problems.add("duplicate goal id " + goal.goalId());
            }
            if (!(goal.minimumDetectableEffect() >= 0)) {
                problems.add("minimum detectable effect of " + goal.goalId() + " must not be negative");
            }
            if (!(goal.weight() >= 0)) {
                problems.add("weight of goal " + goal.goalId() + " must not be negative");
            }
        }
    }

    private void checkStatistics(ExperimentConfig config, List<String> problems) {
        StatisticalConfig statistics = config.statistics();
        if (statistics == null) {
            problems.add("statistical configuration is required");
            return;
        }
        requireOpenUnit("significance threshold", statistics.significanceThreshold(), problems);
        requireOpenUnit("power", statistics.power(), problems);
        requireOpenUnit("confidence level", statistics.confidenceLevel(), problems);
        if (config.testType() == TestType.SEQUENTIAL) {
            if (statistics.sequential() == null) {
                problems.add("a sequential test needs sequential boundaries");
            } else if (statistics.sequential().plannedLooks() < 1) {
                problems.add("planned looks must be at least 1");
            }
        }
    }

    private void checkAudience(AudienceSegment audience, List<String> problems) {
        if (audience == null) {
            return;
        }
        audience.criteria().forEach(c -> checkCriterion(c, problems));
        for (ExclusionGroup group : audience.exclusions()) {
            group.criteria().forEach(c -> checkCriterion(c, problems));
        }
    }

    private static void checkCriterion(SegmentCriterion criterion, List<String> problems) {
        int operands = criterion.operands().size();
        boolean ok = switch (criterion.operator()) {
            case EXISTS -> operands == 0;
            case IN, NOT_IN -> operands >= 1;
            default -> operands == 1;
        };
        if (!ok) {
            problems.add("criterion on " + criterion.field() + " has " + operands
                    + " operands, which " + criterion.operator() + " does not accept");
        }
    }

    private static void requireOpenUnit(String name, double value, List<String> problems) {
        if (!(value > 0 && value < 1)) {
            problems.add(name + " must be in (0, 1), was " + value);
        }
    }
}
