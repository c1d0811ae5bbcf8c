package org.javai.experiment.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.experiment.*;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.analysis.PowerAnalysis;
import org.javai.experiment.analysis.Recommendation;
import org.javai.experiment.analysis.Verdict;
import org.javai.experiment.model.AnalysisMethod;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.TestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.lang.reflect.Proxy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsOpReporterTest {

	private List<String> capturedMessages;
	private MetricsOpReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		reporter = new MetricsOpReporter(null, capturingLogger(capturedMessages, false));
	}

	@Test
	void report_emitsFailureEventAsJsonLine() {
		reporter.report(createFailure("ExperimentEngine.trackConversion", "no_assignment", "User u1 has no assignment"));

		assertThat(capturedMessages).hasSize(1);
		String json = capturedMessages.get(0);
		assertThat(json).startsWith("{").endsWith("}");
		assertThat(json).contains("\"eventType\":\"failure\"");
		assertThat(json).contains("\"trackingKey\":\"ExperimentEngine.trackConversion\"");
		assertThat(json).contains("\"code\":\"experiment:no_assignment\"");
		assertThat(json).contains("\"type\":\"PERMANENT\"");
		assertThat(json).contains("\"timestamp\":\"2024-03-01T10:00:00Z\"");
		assertThat(json).contains("\"tags\":{\"testId\":\"checkout\"}");
	}

	@Test
	void escapeJson_escapesEveryControlCharacter() {
		assertThat(MetricsOpReporter.escapeJson("a\\b\"c\td")).isEqualTo("a\\\\b\\\"c\\td");
		assertThat(MetricsOpReporter.escapeJson("bell\u0001\u001f")).isEqualToIgnoringCase("bell\\u0001\\u001f");
		assertThat(MetricsOpReporter.escapeJson(null)).isEmpty();
	}

	@Test
	void report_controlCharactersInTags_stillParseAsJson() throws Exception {
		Failure failure = new Failure(FailureId.of(ExperimentFailures.NAMESPACE, "not_found"), "line\nbreak",
				FailureType.PERMANENT, null, "op", Instant.parse("2024-03-01T10:00:00Z"), null,
				Map.of("testId", "back\bspace\u0001"), null);

		reporter.report(failure);

		JsonNode json = new ObjectMapper().readTree(capturedMessages.get(0));
		assertThat(json.get("tags").get("testId").asText()).isEqualTo("back\bspace\u0001");
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() {
		MetricsOpReporter namespaced = new MetricsOpReporter("web", capturingLogger(capturedMessages, false));

		namespaced.report(createFailure("ExperimentStore.variantStats", "timeout", "slow"));

		assertThat(capturedMessages.get(0)).contains("\"trackingKey\":\"web.ExperimentStore.variantStats\"");
	}

	@Test
	void buildTrackingKey_blankNamespace_isIgnored() {
		MetricsOpReporter blank = new MetricsOpReporter("  ", capturingLogger(capturedMessages, false));

		assertThat(blank.buildTrackingKey(createFailure("op", "x", "y"))).isEqualTo("op");
	}

	@Test
	void report_escapesQuotesAndNewlines() {
		reporter.report(createFailure("op", "invalid_configuration", "name \"A\" is\nduplicated"));

		assertThat(capturedMessages.get(0)).contains("name \\\"A\\\" is\\nduplicated");
	}

	@Test
	void reportTransition_emitsFromAndTo() {
		Experiment running = ExperimentFixtures.running(ExperimentFixtures.abConfig("checkout").build(), "checkout");

		reporter.reportTransition(running, TestStatus.DRAFT);

		String json = capturedMessages.get(0);
		assertThat(json).contains("\"eventType\":\"transition\"");
		assertThat(json).contains("\"from\":\"DRAFT\"");
		assertThat(json).contains("\"to\":\"RUNNING\"");
		assertThat(json).contains("\"version\":1");
	}

	@Test
	void reportWeightsUpdated_emitsWeightObject() {
		Map<String, Double> weights = new LinkedHashMap<>();
		weights.put("A", 0.25);
		weights.put("B", 0.75);

		reporter.reportWeightsUpdated("bandit", weights);

		assertThat(capturedMessages.get(0))
				.contains("\"eventType\":\"weights_updated\"")
				.contains("\"weights\":{\"A\":0.25,\"B\":0.75}");
	}

	@Test
	void reportAnalysis_includesVerdictAndWinner() {
		AnalysisResult result = new AnalysisResult("checkout", AnalysisMethod.FREQUENTIST, ExperimentFixtures.NOW,
				Verdict.SIGNIFICANT_WINNER, "B", Recommendation.LAUNCH, List.of(), List.of(),
				new PowerAnalysis(3841, 1000, 0.9), 0, 0.05, 2000);

		reporter.reportAnalysis(result);

		assertThat(capturedMessages.get(0))
				.contains("\"eventType\":\"analysis\"")
				.contains("\"verdict\":\"SIGNIFICANT_WINNER\"")
				.contains("\"winner\":\"B\"")
				.contains("\"sampleSize\":2000");
	}

	@Test
	void report_loggerThrows_doesNotPropagate() {
		MetricsOpReporter broken = new MetricsOpReporter(null, capturingLogger(new ArrayList<>(), true));

		assertThatCode(() -> broken.report(createFailure("op", "x", "y"))).doesNotThrowAnyException();
	}

	private static Failure createFailure(String operation, String name, String message) {
		return new Failure(FailureId.of(ExperimentFailures.NAMESPACE, name), message, FailureType.PERMANENT, null,
				operation, Instant.parse("2024-03-01T10:00:00Z"), null, Map.of("testId", "checkout"), null);
	}

	/**
	 * A logger that records {@code info(String)} calls and reports every level as disabled.
	 */
	private static Logger capturingLogger(List<String> messages, boolean throwOnInfo) {
		return (Logger) Proxy.newProxyInstance(Logger.class.getClassLoader(), new Class<?>[]{Logger.class},
				(proxy, method, args) -> {
					if (method.getName().equals("info") && args != null && args.length == 1 && args[0] instanceof String s) {
						if (throwOnInfo) {
							throw new RuntimeException("Simulated logging failure");
						}
						messages.add(s);
						return null;
					}
					if (method.getName().equals("getName")) {
						return "test";
					}
					return method.getReturnType() == boolean.class ? Boolean.FALSE : null;
				});
	}
}
