package org.javai.experiment.lifecycle;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.ExperimentFailures;
import org.javai.experiment.Outcome;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.store.ExperimentStore;

/**
 * Read-modify-write of one experiment through the store's compare-and-set.
 *
 * <p>The change function sees the latest stored snapshot and either rejects it with a failed
 * outcome or returns the replacement. A lost race re-reads and re-applies the change; the loop
 * only repeats when another writer committed, so it always makes progress.
 */
public class ExperimentUpdater {

    private static final Logger LOG = LogManager.getLogger(ExperimentUpdater.class);

    private final ExperimentStore store;
    private final Boundary boundary;

    public ExperimentUpdater(ExperimentStore store, Boundary boundary) {
        this.store = store;
        this.boundary = boundary;
    }

    public Outcome<Experiment> load(String operation, String testId) {
        Outcome<Optional<Experiment>> found = boundary.call("ExperimentStore.findExperiment", tags(testId),
                () -> store.findExperiment(testId));
        return found.flatMap(experiment -> experiment.<Outcome<Experiment>>map(Outcome::ok)
                .orElseGet(() -> ExperimentFailures.notFound(boundary.clock(), operation, testId)));
    }

    public Outcome<VersionedChange> update(String operation, String testId,
                                           Function<Experiment, Outcome<Experiment>> change) {
        while (true) {
            Outcome<Experiment> loaded = load(operation, testId);
            if (loaded.isFail()) {
                return propagate(loaded);
            }
            Experiment current = loaded.getOrThrow();
            Outcome<Experiment> proposed = change.apply(current);
            if (proposed.isFail()) {
                return propagate(proposed);
            }
            Experiment next = proposed.getOrThrow();
            Outcome<Boolean> swapped = boundary.call("ExperimentStore.compareAndSet", tags(testId),
                    () -> store.compareAndSet(current, next));
            if (swapped.isFail()) {
                return propagate(swapped);
            }
            if (swapped.getOrThrow()) {
                return Outcome.ok(new VersionedChange(current, next));
            }
            LOG.debug("Lost update race on {} at version {}; retrying {}", testId, current.version(), operation);
        }
    }

    private static <T> Outcome<T> propagate(Outcome<?> failed) {
        return Outcome.fail(failed.failureIfAny().orElseThrow());
    }

    private static Map<String, String> tags(String testId) {
        return Map.of("testId", testId);
    }
}
