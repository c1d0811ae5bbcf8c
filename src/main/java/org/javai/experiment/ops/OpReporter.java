package org.javai.experiment.ops;

import java.util.Map;

import org.javai.experiment.Failure;
import org.javai.experiment.analysis.AnalysisResult;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.TestStatus;

/**
 * Reports failures and notable engine events for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 */
public interface OpReporter {

    /**
     * Reports a failure occurrence.
     */
    void report(Failure failure);

    /**
     * Reports a lifecycle transition that has been committed to the store.
     *
     * @param experiment the experiment after the transition
     * @param from the status it left
     */
    default void reportTransition(Experiment experiment, TestStatus from) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports traffic weights written by the bandit optimizer.
     *
     * @param testId the bandit test
     * @param weights variant id to new weight, in variant order
     */
    default void reportWeightsUpdated(String testId, Map<String, Double> weights) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a completed analysis.
     */
    default void reportAnalysis(AnalysisResult result) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
