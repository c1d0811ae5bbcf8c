package org.javai.experiment.analysis;

/**
 * The analysing thread was interrupted; whatever had been computed is discarded.
 */
public class AnalysisCancelledException extends Exception {

    public AnalysisCancelledException(String testId) {
        super("Analysis of " + testId + " was cancelled");
    }

    static void checkInterrupted(String testId) throws AnalysisCancelledException {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisCancelledException(testId);
        }
    }
}
