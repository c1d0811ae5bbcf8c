package org.javai.experiment.store;

import java.util.List;
import java.util.Optional;

import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.VariantStats;
import org.javai.experiment.model.event.ExperimentEvent;

/**
 * Persistence seam of the engine. Every mutating operation is atomic per key, so callers
 * never need a lock wider than one test, one assignment or one variant counter.
 *
 * <p>Implementations may be remote and slow; they signal trouble with {@link StoreException}
 * (and {@link StoreTimeoutException} when a latency budget is exceeded) rather than blocking
 * indefinitely. The engine translates these into failed outcomes.
 */
public interface ExperimentStore {

    /**
     * Stores a new experiment.
     *
     * @return false if an experiment with the same id already exists
     */
    boolean insertExperiment(Experiment experiment) throws StoreException;

    Optional<Experiment> findExperiment(String testId) throws StoreException;

    List<Experiment> listExperiments() throws StoreException;

    /**
     * Replaces the stored experiment with {@code updated} only if the stored version still
     * equals {@code expected.version()}.
     *
     * @return true if the swap happened
     */
    boolean compareAndSet(Experiment expected, Experiment updated) throws StoreException;

    /**
     * Stores the assignment unless one already exists for its (test, user) pair.
     *
     * @return the assignment that is stored after the call: the argument if it won, otherwise
     *         the earlier one
     */
    Assignment putAssignmentIfAbsent(Assignment assignment) throws StoreException;

    Optional<Assignment> findAssignment(String testId, String userId) throws StoreException;

    /**
     * All assignments of a user across tests, oldest first.
     */
    List<Assignment> assignmentsForUser(String userId) throws StoreException;

    /**
     * Counts an exposure against the assignment's variant.
     *
     * @param repeatable when false only the first exposure of the assignment is counted
     * @return true if the exposure counter was incremented
     */
    boolean recordExposure(Assignment assignment, boolean repeatable) throws StoreException;

    /**
     * Counts a conversion against the assignment's variant. An assignment that was never
     * exposed is exposed first, so exposures never trail conversions.
     *
     * @param repeatable when false a second conversion on the same goal is ignored
     * @return true if the conversion was recorded
     */
    boolean recordConversion(Assignment assignment, String goalId, double value, boolean repeatable)
            throws StoreException;

    void recordMetric(Assignment assignment, String metricName, double value) throws StoreException;

    void appendEvent(ExperimentEvent event) throws StoreException;

    List<ExperimentEvent> events(String testId) throws StoreException;

    /**
     * A consistent-enough snapshot of one variant's counters: conversions are read before
     * exposures so that a snapshot never shows more converters than exposed users.
     */
    VariantStats variantStats(String testId, String variantId) throws StoreException;

    /**
     * Per-user totals of a goal over the variant's exposed assignments; zero for users that
     * never converted. Used by resampling analyses.
     */
    double[] userOutcomes(String testId, String variantId, String goalId) throws StoreException;
}
