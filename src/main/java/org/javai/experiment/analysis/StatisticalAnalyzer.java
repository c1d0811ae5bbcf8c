package org.javai.experiment.analysis;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.EngineSettings;
import org.javai.experiment.model.AnalysisMethod;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.Goal;
import org.javai.experiment.model.GoalMetric;
import org.javai.experiment.model.StatisticalConfig;
import org.javai.experiment.model.TestType;
import org.javai.experiment.model.Variant;
import org.javai.experiment.model.VariantStats;

/**
 * Turns a counter snapshot into an {@link AnalysisResult}.
 *
 * <p>Each treatment is compared with control on every goal. Only the primary goal's verdict
 * becomes the verdict of the analysis; secondary goals are reported alongside.
 *
 * <p>Verdict rules for one goal:
 * <ul>
 *   <li>an arm below the minimum sample size gives INSUFFICIENT_DATA and nothing is significant;</li>
 *   <li>treatments that are significant and better than control give SIGNIFICANT_WINNER, the
 *       winner being the one with the largest effect in the goal's direction;</li>
 *   <li>when every treatment is significantly worse, control is the winner;</li>
 *   <li>when nothing is significant and every interval lies inside +-MDE, NO_DIFFERENCE;</li>
 *   <li>otherwise INCONCLUSIVE.</li>
 * </ul>
 *
 * <p>Random streams are seeded from the engine seed and the test id, so the same snapshot
 * always yields the same report.
 */
public class StatisticalAnalyzer {

    private static final Logger LOG = LogManager.getLogger(StatisticalAnalyzer.class);

    private final EngineSettings settings;
    private final Clock clock;

    public StatisticalAnalyzer(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public AnalysisResult analyze(AnalysisInput input) throws AnalysisCancelledException {
        Experiment experiment = input.experiment();
        StatisticalConfig config = experiment.statistics();
        Variant control = experiment.control()
                .orElseThrow(() -> new IllegalStateException("Test " + experiment.testId() + " has no control"));
        ComparisonMethod method = methodFor(config.method());
        ComparisonContext context = new ComparisonContext(experiment.testId(), config.confidenceLevel(),
                new Well19937c(settings.randomSeed() * 31 + experiment.testId().hashCode()));

        double alphaAtLook = alphaAtLook(experiment, input.look());
        boolean sampleMet = experiment.variants().stream()
                .allMatch(v -> input.stats(v.variantId()).exposures() >= experiment.minimumSampleSize());

        List<GoalResult> goals = new ArrayList<>();
        for (Goal goal : experiment.goals()) {
            AnalysisCancelledException.checkInterrupted(experiment.testId());
            goals.add(analyzeGoal(input, goal, goal == experiment.primaryGoal(), control, method, context,
                    alphaAtLook, sampleMet));
        }
        GoalResult primary = goals.get(0);

        Map<String, Double> bestProbabilities = config.method() == AnalysisMethod.BAYESIAN
                ? probabilityToBeBest(input, experiment.primaryGoal(), (BayesianComparison) method, context)
                : Map.of();

        List<VariantSummary> summaries = new ArrayList<>();
        long total = 0;
        for (Variant variant : experiment.variants()) {
            VariantStats stats = input.stats(variant.variantId());
            total += stats.exposures();
            summaries.add(summary(experiment, variant, stats, bestProbabilities.get(variant.variantId())));
        }

        Verdict verdict = primary.verdict();
        String winner = verdict == Verdict.SIGNIFICANT_WINNER ? primary.bestVariantId() : null;
        AnalysisResult result = new AnalysisResult(
                experiment.testId(),
                config.method(),
                clock.instant(),
                verdict,
                winner,
                Recommendation.forVerdict(verdict),
                summaries,
                goals,
                power(input, experiment, control, primary, alphaAtLook),
                input.look(),
                alphaAtLook,
                total);
        LOG.debug("Analysed {}: verdict={}, winner={}, alpha={}", experiment.testId(), verdict, winner, alphaAtLook);
        return result;
    }

    private GoalResult analyzeGoal(AnalysisInput input, Goal goal, boolean primary, Variant control,
                                   ComparisonMethod method, ComparisonContext context, double alpha,
                                   boolean sampleMet) throws AnalysisCancelledException {
        Experiment experiment = input.experiment();
        ArmData controlArm = arm(input, goal, control.variantId());
        List<VariantComparison> comparisons = new ArrayList<>();
        for (Variant treatment : experiment.treatments()) {
            comparisons.add(method.compare(goal, controlArm, arm(input, goal, treatment.variantId()), context));
        }

        if (method.usesPValues()) {
            double[] raw = comparisons.stream().mapToDouble(VariantComparison::pValue).toArray();
            double[] adjusted = PValueAdjuster.adjust(raw, experiment.statistics().correction());
            for (int i = 0; i < comparisons.size(); i++) {
                comparisons.set(i, comparisons.get(i).withAdjustedPValue(adjusted[i])
                        .withSignificant(sampleMet && adjusted[i] < alpha));
            }
        } else {
            double confidence = experiment.statistics().confidenceLevel();
            for (int i = 0; i < comparisons.size(); i++) {
                double probability = comparisons.get(i).probabilityToBeatControl();
                boolean decisive = probability >= confidence || probability <= 1.0 - confidence;
                comparisons.set(i, comparisons.get(i).withSignificant(sampleMet && decisive));
            }
        }

        if (!sampleMet) {
            return new GoalResult(goal.goalId(), primary, goal.metric(), comparisons, Verdict.INSUFFICIENT_DATA, null);
        }

        Optional<VariantComparison> best = comparisons.stream()
                .filter(VariantComparison::significant)
                .filter(c -> goal.direction().orient(c.difference()) > 0)
                .max(Comparator.comparingDouble(c -> goal.direction().orient(c.difference())));
        if (best.isPresent()) {
            return new GoalResult(goal.goalId(), primary, goal.metric(), comparisons,
                    Verdict.SIGNIFICANT_WINNER, best.get().variantId());
        }

        boolean controlDominates = comparisons.stream()
                .allMatch(c -> c.significant() && goal.direction().orient(c.difference()) < 0);
        if (controlDominates) {
            return new GoalResult(goal.goalId(), primary, goal.metric(), comparisons,
                    Verdict.SIGNIFICANT_WINNER, control.variantId());
        }

        double mde = goal.minimumDetectableEffect();
        boolean equivalent = mde > 0 && comparisons.stream()
                .noneMatch(VariantComparison::significant)
                && comparisons.stream().allMatch(c -> c.interval().within(mde));
        return new GoalResult(goal.goalId(), primary, goal.metric(), comparisons,
                equivalent ? Verdict.NO_DIFFERENCE : Verdict.INCONCLUSIVE, null);
    }

    private ArmData arm(AnalysisInput input, Goal goal, String variantId) {
        if (goal.metric() == GoalMetric.BINARY) {
            VariantStats stats = input.stats(variantId);
            return ArmData.binary(variantId, stats.exposures(), stats.conversions(goal.goalId()));
        }
        return ArmData.continuous(variantId, input.outcomes(goal.goalId(), variantId));
    }

    private Map<String, Double> probabilityToBeBest(AnalysisInput input, Goal goal, BayesianComparison bayesian,
                                                    ComparisonContext context) throws AnalysisCancelledException {
        List<Variant> variants = input.experiment().variants();
        List<ArmData> arms = new ArrayList<>();
        for (Variant variant : variants) {
            arms.add(arm(input, goal, variant.variantId()));
        }
        double[] probabilities = bayesian.probabilityToBeBest(goal, arms, context);
        Map<String, Double> byVariant = new HashMap<>();
        for (int i = 0; i < variants.size(); i++) {
            byVariant.put(variants.get(i).variantId(), probabilities[i]);
        }
        return byVariant;
    }

    private static VariantSummary summary(Experiment experiment, Variant variant, VariantStats stats,
                                          Double probabilityToBeBest) {
        Map<String, Long> conversions = new HashMap<>();
        Map<String, Double> rates = new HashMap<>();
        for (Goal goal : experiment.goals()) {
            conversions.put(goal.goalId(), stats.conversions(goal.goalId()));
            rates.put(goal.goalId(), stats.conversionRate(goal.goalId()));
        }
        return new VariantSummary(variant.variantId(), variant.control(), stats.exposures(), conversions, rates,
                stats.metrics(), probabilityToBeBest);
    }

    private PowerAnalysis power(AnalysisInput input, Experiment experiment, Variant control, GoalResult primary,
                                double alpha) {
        Goal goal = experiment.primaryGoal();
        StatisticalConfig config = experiment.statistics();
        long required = PowerCalculator.requiredSampleSizePerArm(goal, arm(input, goal, control.variantId()),
                config.significanceThreshold(), config.power());
        long smallest = experiment.variants().stream()
                .mapToLong(v -> input.stats(v.variantId()).exposures())
                .min()
                .orElse(0);
        double observed = primary.comparisons().stream()
                .max(Comparator.comparingDouble(c -> Math.abs(c.difference())))
                .map(c -> PowerCalculator.observedPower(c, alpha))
                .orElse(0.0);
        return new PowerAnalysis(required, smallest, observed);
    }

    private static double alphaAtLook(Experiment experiment, int look) {
        StatisticalConfig config = experiment.statistics();
        if (experiment.testType() != TestType.SEQUENTIAL || config.sequential() == null || look < 1) {
            return config.significanceThreshold();
        }
        return AlphaSpending.thresholdForLook(config.sequential(), config.significanceThreshold(), look);
    }

    private ComparisonMethod methodFor(AnalysisMethod method) {
        return switch (method) {
            case FREQUENTIST -> new FrequentistComparison();
            case BAYESIAN -> new BayesianComparison(settings.bayesianDraws());
            case BOOTSTRAP -> new BootstrapComparison(settings.bootstrapIterations());
        };
    }
}
