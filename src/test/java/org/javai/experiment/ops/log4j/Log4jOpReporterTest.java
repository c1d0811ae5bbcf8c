package org.javai.experiment.ops.log4j;

import org.apache.logging.log4j.Level;
import org.javai.experiment.*;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.analysis.PowerAnalysis;
import org.javai.experiment.analysis.Recommendation;
import org.javai.experiment.analysis.Verdict;
import org.javai.experiment.model.AnalysisMethod;
import org.javai.experiment.model.TestStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	@Test
	void levelFor_mapsFailureTypes() {
		assertThat(Log4jOpReporter.levelFor(FailureType.DEFECT)).isEqualTo(Level.ERROR);
		assertThat(Log4jOpReporter.levelFor(FailureType.TRANSIENT)).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(FailureType.PERMANENT)).isEqualTo(Level.INFO);
	}

	@Test
	void markers_areDistinct() {
		assertThat(List.of(Log4jOpReporter.FAILURE_MARKER, Log4jOpReporter.LIFECYCLE_MARKER,
				Log4jOpReporter.BANDIT_MARKER, Log4jOpReporter.ANALYSIS_MARKER))
				.extracting(m -> m.getName())
				.containsExactly("FAILURE", "LIFECYCLE", "BANDIT", "ANALYSIS");
	}

	@Test
	void everyEvent_logsWithoutThrowing() {
		Log4jOpReporter reporter = new Log4jOpReporter("org.javai.experiment.Log4jOpReporterTest");
		Failure defect = new Failure(FailureKind.defect(FailureId.of("defect", "NullPointerException"), "npe"),
				new NullPointerException("npe"), "UncaughtException:main", ExperimentFixtures.NOW, "req-9",
				Map.of("testId", "checkout"));
		AnalysisResult result = new AnalysisResult("checkout", AnalysisMethod.BAYESIAN, ExperimentFixtures.NOW,
				Verdict.INCONCLUSIVE, null, Recommendation.CONTINUE, List.of(), List.of(),
				new PowerAnalysis(0, 0, 0.0), 0, 0.05, 0);

		assertThatCode(() -> {
			reporter.report(defect);
			reporter.reportTransition(ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout").build(),
					"checkout"), TestStatus.DRAFT);
			reporter.reportWeightsUpdated("bandit", Map.of("A", 0.5, "B", 0.5));
			reporter.reportAnalysis(result);
		}).doesNotThrowAnyException();
	}
}
