package org.javai.experiment.analysis;

import org.javai.experiment.ExperimentFixtures;
import org.javai.experiment.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StatisticalAnalyzerTest {

    private static final String GOAL = ExperimentFixtures.GOAL;

    private StatisticalAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new StatisticalAnalyzer(ExperimentFixtures.settings(), ExperimentFixtures.clock());
    }

    @Test
    void frequentist_clearLift_declaresTreatmentWinner() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults()),
                ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 1000, 150));

        VariantComparison b = result.comparison(GOAL, "B").orElseThrow();
        assertThat(b.pValue()).isCloseTo(0.000723, within(0.00001));
        assertThat(b.testStatistic()).isCloseTo(3.3806, within(0.0001));
        assertThat(b.difference()).isCloseTo(0.05, within(1e-12));
        assertThat(b.relativeLift()).isCloseTo(50.0, within(1e-9));
        assertThat(b.interval().lower()).isGreaterThan(0.0);
        assertThat(b.significant()).isTrue();
        assertThat(result.verdict()).isEqualTo(Verdict.SIGNIFICANT_WINNER);
        assertThat(result.winner()).contains("B");
        assertThat(result.recommendation()).isEqualTo(Recommendation.LAUNCH);
        assertThat(result.totalSampleSize()).isEqualTo(2000);
        assertThat(result.analyzedAt()).isEqualTo(ExperimentFixtures.NOW);
    }

    @Test
    void frequentist_smallSample_isInconclusive() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults()),
                ExperimentFixtures.stats("A", 100, 10), ExperimentFixtures.stats("B", 100, 12));

        VariantComparison b = result.comparison(GOAL, "B").orElseThrow();
        assertThat(b.pValue()).isCloseTo(0.6513, within(0.0001));
        assertThat(b.significant()).isFalse();
        assertThat(result.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(result.winningVariantId()).isNull();
        assertThat(result.recommendation()).isEqualTo(Recommendation.CONTINUE);
    }

    @Test
    void belowMinimumSample_isInsufficientEvenWhenSignificant() throws AnalysisCancelledException {
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .minimumSampleSize(1500)
                .build(), "checkout");

        AnalysisResult result = analyze(experiment,
                ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 1000, 150));

        assertThat(result.verdict()).isEqualTo(Verdict.INSUFFICIENT_DATA);
        assertThat(result.comparison(GOAL, "B").orElseThrow().significant()).isFalse();
        assertThat(result.winner()).isEmpty();
    }

    @Test
    void tightIntervalInsideMde_isNoDifference() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults()),
                ExperimentFixtures.stats("A", 20000, 2000), ExperimentFixtures.stats("B", 20000, 2005));

        assertThat(result.comparison(GOAL, "B").orElseThrow().interval().within(0.02)).isTrue();
        assertThat(result.verdict()).isEqualTo(Verdict.NO_DIFFERENCE);
        assertThat(result.recommendation()).isEqualTo(Recommendation.STOP);
    }

    @Test
    void zeroMde_neverDeclaresNoDifference() throws AnalysisCancelledException {
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .primaryGoal(Goal.conversion(GOAL, 0.0))
                .build(), "checkout");

        AnalysisResult result = analyze(experiment,
                ExperimentFixtures.stats("A", 20000, 2000), ExperimentFixtures.stats("B", 20000, 2005));

        assertThat(result.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(result.power().requiredSampleSizePerArm()).isZero();
    }

    @Test
    void severalSignificantTreatments_largestEffectWins() throws AnalysisCancelledException {
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .variant(Variant.treatment("C"))
                .allocation(TrafficAllocation.weighted(Map.of("A", 0.34, "B", 0.33, "C", 0.33)))
                .testType(TestType.MULTIVARIATE)
                .build(), "checkout");

        AnalysisResult result = analyze(experiment, ExperimentFixtures.stats("A", 1000, 100),
                ExperimentFixtures.stats("B", 1000, 150), ExperimentFixtures.stats("C", 1000, 180));

        assertThat(result.winner()).contains("C");
        VariantComparison b = result.comparison(GOAL, "B").orElseThrow();
        assertThat(b.adjustedPValue()).isGreaterThanOrEqualTo(b.pValue());
        assertThat(result.primary().comparisons()).extracting(VariantComparison::variantId).containsExactly("B", "C");
    }

    @Test
    void everyTreatmentWorse_controlWins() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults()),
                ExperimentFixtures.stats("A", 1000, 150), ExperimentFixtures.stats("B", 1000, 100));

        assertThat(result.verdict()).isEqualTo(Verdict.SIGNIFICANT_WINNER);
        assertThat(result.winner()).contains("A");
    }

    @Test
    void decreaseGoal_lowerRateWins() throws AnalysisCancelledException {
        Goal bounce = Goal.conversion("bounce", 0.02).withDirection(GoalDirection.DECREASE);
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("landing")
                .primaryGoal(bounce)
                .build(), "landing");

        AnalysisResult result = analyze(experiment, stats("A", 1000, "bounce", 300), stats("B", 1000, "bounce", 200));

        assertThat(result.comparison("bounce", "B").orElseThrow().difference()).isNegative();
        assertThat(result.winner()).contains("B");
    }

    @Test
    void secondaryGoal_isReportedButDoesNotDriveVerdict() throws AnalysisCancelledException {
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .secondaryGoal(Goal.conversion("click", 0.02))
                .build(), "checkout");
        VariantStats a = new VariantStats("A", 1000, Map.of(
                GOAL, new GoalStats(GOAL, 100, null), "click", new GoalStats("click", 200, null)), Map.of());
        VariantStats b = new VariantStats("B", 1000, Map.of(
                GOAL, new GoalStats(GOAL, 100, null), "click", new GoalStats("click", 400, null)), Map.of());

        AnalysisResult result = analyze(experiment, a, b);

        assertThat(result.goals()).extracting(GoalResult::goalId).containsExactly(GOAL, "click");
        assertThat(result.goals().get(1).primary()).isFalse();
        assertThat(result.goals().get(1).verdict()).isEqualTo(Verdict.SIGNIFICANT_WINNER);
        assertThat(result.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(result.variants().get(1).conversionRates()).containsEntry("click", 0.4);
    }

    @Test
    void bayesian_clearLift_reportsPosteriorProbabilities() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults().withMethod(AnalysisMethod.BAYESIAN)),
                ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 1000, 150));

        VariantComparison b = result.comparison(GOAL, "B").orElseThrow();
        assertThat(b.pValue()).isNull();
        assertThat(b.probabilityToBeatControl()).isGreaterThan(0.99);
        assertThat(b.interval().lower()).isGreaterThan(0.0);
        assertThat(result.winner()).contains("B");
        double best = result.variants().stream().mapToDouble(VariantSummary::probabilityToBeBest).sum();
        assertThat(best).isCloseTo(1.0, within(1e-9));
        assertThat(result.variants().get(1).probabilityToBeBest()).isGreaterThan(0.99);
    }

    @Test
    void bayesian_isReproducibleForTheSameSnapshot() throws AnalysisCancelledException {
        Experiment experiment = abTest(StatisticalConfig.defaults().withMethod(AnalysisMethod.BAYESIAN));

        AnalysisResult first = analyze(experiment, ExperimentFixtures.stats("A", 500, 50), ExperimentFixtures.stats("B", 500, 60));
        AnalysisResult second = analyze(experiment, ExperimentFixtures.stats("A", 500, 50), ExperimentFixtures.stats("B", 500, 60));

        assertThat(second.comparison(GOAL, "B").orElseThrow().interval())
                .isEqualTo(first.comparison(GOAL, "B").orElseThrow().interval());
        assertThat(second.variants()).isEqualTo(first.variants());
    }

    @Test
    void bayesian_closeArms_areInconclusive() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults().withMethod(AnalysisMethod.BAYESIAN)),
                ExperimentFixtures.stats("A", 100, 10), ExperimentFixtures.stats("B", 100, 12));

        assertThat(result.comparison(GOAL, "B").orElseThrow().probabilityToBeatControl()).isBetween(0.5, 0.9);
        assertThat(result.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
    }

    @Test
    void bootstrap_clearLift_excludesZero() throws AnalysisCancelledException {
        AnalysisResult result = analyze(abTest(StatisticalConfig.defaults().withMethod(AnalysisMethod.BOOTSTRAP)),
                ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 1000, 150));

        VariantComparison b = result.comparison(GOAL, "B").orElseThrow();
        assertThat(b.pValue()).isLessThan(0.01);
        assertThat(b.interval().lower()).isGreaterThan(0.0);
        assertThat(b.interval().contains(0.05)).isTrue();
        assertThat(b.standardError()).isCloseTo(0.0147, within(0.003));
        assertThat(result.winner()).contains("B");
    }

    @Test
    void continuousGoal_welchAndBootstrapAgree() throws AnalysisCancelledException {
        double[] control = values(200, 10.0);
        double[] treatment = values(200, 11.0);
        for (AnalysisMethod method : List.of(AnalysisMethod.FREQUENTIST, AnalysisMethod.BOOTSTRAP, AnalysisMethod.BAYESIAN)) {
            Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("basket")
                    .primaryGoal(Goal.value("revenue", 0.5))
                    .statistics(StatisticalConfig.defaults().withMethod(method))
                    .build(), "basket");
            Map<String, Map<String, double[]>> outcomes = Map.of("revenue", Map.of("A", control, "B", treatment));
            AnalysisInput input = new AnalysisInput(experiment,
                    Map.of("A", new VariantStats("A", 200, Map.of(), Map.of()),
                            "B", new VariantStats("B", 200, Map.of(), Map.of())),
                    outcomes, 0);

            AnalysisResult result = analyzer.analyze(input);

            VariantComparison b = result.comparison("revenue", "B").orElseThrow();
            assertThat(b.difference()).as(method.name()).isCloseTo(1.0, within(1e-9));
            assertThat(b.interval().contains(1.0)).as(method.name()).isTrue();
            assertThat(b.cohensD()).as(method.name()).isCloseTo(1.0 / Math.sqrt(2.0), within(0.01));
            assertThat(result.winner()).as(method.name()).contains("B");
        }
    }

    @Test
    void sequential_earlyLook_needsOverwhelmingEvidence() throws AnalysisCancelledException {
        Experiment experiment = sequentialTest();
        VariantStats a = ExperimentFixtures.stats("A", 1000, 100);
        VariantStats b = ExperimentFixtures.stats("B", 1000, 150);

        AnalysisResult first = analyzer.analyze(new AnalysisInput(experiment, Map.of("A", a, "B", b), Map.of(), 1));
        AnalysisResult last = analyzer.analyze(new AnalysisInput(experiment, Map.of("A", a, "B", b), Map.of(), 5));

        assertThat(first.look()).isEqualTo(1);
        assertThat(first.alphaAtLook()).isCloseTo(1.1726e-5, within(1e-8));
        assertThat(first.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(last.alphaAtLook()).isCloseTo(0.021570, within(1e-5));
        assertThat(last.verdict()).isEqualTo(Verdict.SIGNIFICANT_WINNER);
    }

    @Test
    void power_reportsPlanAndObservedPower() throws AnalysisCancelledException {
        Experiment experiment = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .primaryGoal(Goal.conversion(GOAL, 0.02).withExpectedBaseline(0.1))
                .build(), "checkout");

        AnalysisResult result = analyze(experiment,
                ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 800, 120));

        assertThat(result.power().requiredSampleSizePerArm()).isEqualTo(3841);
        assertThat(result.power().smallestArm()).isEqualTo(800);
        assertThat(result.power().observedPower()).isBetween(0.0, 1.0);
    }

    @Test
    void interruptedThread_cancelsAnalysis() {
        Experiment experiment = abTest(StatisticalConfig.defaults().withMethod(AnalysisMethod.BOOTSTRAP));
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> analyze(experiment,
                    ExperimentFixtures.stats("A", 1000, 100), ExperimentFixtures.stats("B", 1000, 150)))
                    .isInstanceOf(AnalysisCancelledException.class)
                    .hasMessageContaining("checkout");
        } finally {
            Thread.interrupted();
        }
    }

    private AnalysisResult analyze(Experiment experiment, VariantStats... arms) throws AnalysisCancelledException {
        Map<String, VariantStats> stats = new HashMap<>();
        for (VariantStats arm : arms) {
            stats.put(arm.variantId(), arm);
        }
        return analyzer.analyze(new AnalysisInput(experiment, stats, Map.of(), 0));
    }

    private static Experiment abTest(StatisticalConfig statistics) {
        return ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout").statistics(statistics).build(),
                "checkout");
    }

    private static Experiment sequentialTest() {
        return ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout")
                .testType(TestType.SEQUENTIAL)
                .statistics(StatisticalConfig.defaults().withSequential(SequentialBoundaries.obrienFleming(5)))
                .build(), "checkout");
    }

    private static VariantStats stats(String variantId, long exposures, String goalId, long conversions) {
        return new VariantStats(variantId, exposures, Map.of(goalId, new GoalStats(goalId, conversions, null)), Map.of());
    }

    /**
     * Values cycling through mean-2 .. mean+2, variance close to 2.
     */
    private static double[] values(int n, double mean) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + (i % 5) - 2;
        }
        return values;
    }
}
