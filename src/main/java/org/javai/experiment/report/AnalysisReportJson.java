package org.javai.experiment.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.javai.experiment.FailureId;
import org.javai.experiment.FailureKind;
import org.javai.experiment.Outcome;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.boundary.FailureClassifier;
import org.javai.experiment.ops.OpReporter;

/**
 * Renders analysis reports as JSON for collaborators that ship them elsewhere.
 * Instants are written as ISO-8601 strings.
 */
public class AnalysisReportJson {

    public static final FailureId SERIALIZATION = FailureId.of("report", "serialization");

    private static final FailureClassifier CLASSIFIER = (operation, t) ->
            FailureKind.defect(SERIALIZATION, "Could not render report: " + t.getMessage());

    private final ObjectMapper objectMapper;
    private final Boundary boundary;

    public AnalysisReportJson() {
        this(OpReporter.noOp());
    }

    public AnalysisReportJson(OpReporter reporter) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.boundary = Boundary.of(CLASSIFIER, reporter);
    }

    public Outcome<String> render(AnalysisResult result) {
        return boundary.call("AnalysisReportJson.render", () -> objectMapper.writeValueAsString(result));
    }

    public Outcome<String> renderPretty(AnalysisResult result) {
        return boundary.call("AnalysisReportJson.renderPretty",
                () -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }
}
