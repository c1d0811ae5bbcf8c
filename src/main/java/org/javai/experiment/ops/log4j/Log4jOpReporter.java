package org.javai.experiment.ops.log4j;

import java.util.Map;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.experiment.Failure;
import org.javai.experiment.FailureType;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.TestStatus;
import org.javai.experiment.ops.OpReporter;

/**
 * Reports engine failures and events using Log4j2.
 *
 * <p>Failures are logged at a level chosen by their {@link FailureType}:
 * <ul>
 *   <li>{@code DEFECT} → ERROR</li>
 *   <li>{@code TRANSIENT} → WARN</li>
 *   <li>{@code PERMANENT} → INFO</li>
 * </ul>
 *
 * <p>Lifecycle transitions, bandit weight updates and analyses are logged at INFO, each under
 * its own marker so they can be routed separately.
 */
public class Log4jOpReporter implements OpReporter {

	public static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	public static final Marker LIFECYCLE_MARKER = MarkerManager.getMarker("LIFECYCLE");
	public static final Marker BANDIT_MARKER = MarkerManager.getMarker("BANDIT");
	public static final Marker ANALYSIS_MARKER = MarkerManager.getMarker("ANALYSIS");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.experiment.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.type() == FailureType.DEFECT ? failure.exception() : null)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportTransition(Experiment experiment, TestStatus from) {
		logger.atInfo()
			.withMarker(LIFECYCLE_MARKER)
			.log("Test [{}] moved {} -> {} (version {})",
				experiment.testId(),
				from,
				experiment.status(),
				experiment.version());
	}

	@Override
	public void reportWeightsUpdated(String testId, Map<String, Double> weights) {
		logger.atInfo()
			.withMarker(BANDIT_MARKER)
			.log("Bandit weights for test [{}]: {}", testId, formatWeights(weights));
	}

	@Override
	public void reportAnalysis(AnalysisResult result) {
		logger.atInfo()
			.withMarker(ANALYSIS_MARKER)
			.log("Analysis of test [{}] with {}: verdict={}, winner={}, recommendation={}, look={}, n={}",
				result.testId(),
				result.method(),
				result.verdict(),
				result.winner().orElse("none"),
				result.recommendation(),
				result.look(),
				result.totalSampleSize());
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s]: %s \
			| code=%s, type=%s%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.id(),
				failure.type(),
				formatCorrelationId(failure.correlationId()),
				formatTags(failure.tags())
			).trim();
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? ", correlationId=" + correlationId : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static String formatWeights(Map<String, Double> weights) {
		return weights.entrySet().stream()
				.map(e -> e.getKey() + "=" + String.format("%.4f", e.getValue()))
				.reduce((a, b) -> a + ", " + b)
				.orElse("");
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case DEFECT -> Level.ERROR;
			case TRANSIENT -> Level.WARN;
			case PERMANENT -> Level.INFO;
		};
	}
}
