package org.javai.experiment.ops.metrics;

import java.time.format.DateTimeFormatter;
import java.util.Map;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import org.javai.experiment.Failure;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.TestStatus;
import org.javai.experiment.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports engine events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object on one line, with a configurable namespace prefix on the
 * tracking key:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"web.ExperimentEngine.trackConversion","code":"experiment:no_assignment",...}
 * {"eventType":"analysis","testId":"checkout-button","method":"FREQUENTIST","verdict":"SIGNIFICANT_WINNER",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.experiment.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		emit(buildFailureJson(failure));
	}

	@Override
	public void reportTransition(Experiment experiment, TestStatus from) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "transition", true);
		appendField(sb, "testId", experiment.testId(), false);
		appendField(sb, "from", from.name(), false);
		appendField(sb, "to", experiment.status().name(), false);
		appendNumber(sb, "version", experiment.version());
		sb.append("}");
		emit(sb.toString());
	}

	@Override
	public void reportWeightsUpdated(String testId, Map<String, Double> weights) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "weights_updated", true);
		appendField(sb, "testId", testId, false);
		sb.append(",\"weights\":{");
		boolean first = true;
		for (Map.Entry<String, Double> entry : weights.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(entry.getKey())).append("\":").append(entry.getValue());
			first = false;
		}
		sb.append("}}");
		emit(sb.toString());
	}

	@Override
	public void reportAnalysis(AnalysisResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "analysis", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(result.analyzedAt()), false);
		appendField(sb, "testId", result.testId(), false);
		appendField(sb, "method", result.method().name(), false);
		appendField(sb, "verdict", result.verdict().name(), false);
		appendField(sb, "recommendation", result.recommendation().name(), false);
		if (result.winningVariantId() != null) {
			appendField(sb, "winner", result.winningVariantId(), false);
		}
		appendNumber(sb, "look", result.look());
		appendNumber(sb, "sampleSize", result.totalSampleSize());
		sb.append("}");
		emit(sb.toString());
	}

	private void emit(String json) {
		try {
			logger.info(json);
		} catch (RuntimeException e) {
			// A broken metrics sink must not fail the engine call that triggered it.
			logger.debug("Metrics emission failed", e);
		}
	}

	private String buildFailureJson(Failure failure) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "failure", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(failure.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(failure), false);
		appendField(sb, "code", failure.id().toString(), false);
		appendField(sb, "message", failure.message(), false);
		appendField(sb, "type", failure.type().name(), false);
		appendField(sb, "operation", failure.operation(), false);
		if (failure.correlationId() != null) {
			appendField(sb, "correlationId", failure.correlationId(), false);
		}
		appendTags(sb, failure.tags());
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(Failure failure) {
		if (namespace == null || namespace.isEmpty()) {
			return failure.trackingId();
		}
		return namespace + "." + failure.trackingId();
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private void appendNumber(StringBuilder sb, String key, long value) {
		sb.append(",\"").append(key).append("\":").append(value);
	}

	private void appendTags(StringBuilder sb, Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return;
		}
		sb.append(",\"tags\":{");
		boolean first = true;
		for (Map.Entry<String, String> entry : tags.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(entry.getKey())).append("\":\"")
			  .append(escapeJson(entry.getValue())).append("\"");
			first = false;
		}
		sb.append("}");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	/**
	 * Escapes a value for a JSON string literal, including every control character below 0x20.
	 */
	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return new String(JsonStringEncoder.getInstance().quoteAsString(s));
	}
}
