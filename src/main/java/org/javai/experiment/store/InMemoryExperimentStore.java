package org.javai.experiment.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.DoubleAdder;

import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.VariantStats;
import org.javai.experiment.model.event.ExperimentEvent;

/**
 * Process-local {@link ExperimentStore} on concurrent maps. Never blocks and never throws
 * {@link StoreException} except for writes against an assignment it does not hold.
 *
 * <p>Per-test data is nested under the test id, so test, user and variant ids may contain any
 * character.
 */
public class InMemoryExperimentStore implements ExperimentStore {

    private final Map<String, Experiment> experiments = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Ledger>> ledgers = new ConcurrentHashMap<>();
    private final Map<String, Queue<Assignment>> byUser = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Queue<Ledger>>> byVariant = new ConcurrentHashMap<>();
    private final Map<String, Map<String, VariantCounters>> counters = new ConcurrentHashMap<>();
    private final Map<String, Queue<ExperimentEvent>> events = new ConcurrentHashMap<>();

    @Override
    public boolean insertExperiment(Experiment experiment) {
        return experiments.putIfAbsent(experiment.testId(), experiment) == null;
    }

    @Override
    public Optional<Experiment> findExperiment(String testId) {
        return Optional.ofNullable(experiments.get(testId));
    }

    @Override
    public List<Experiment> listExperiments() {
        List<Experiment> all = new ArrayList<>(experiments.values());
        all.sort(Comparator.comparing(Experiment::createdAt).thenComparing(Experiment::testId));
        return all;
    }

    @Override
    public boolean compareAndSet(Experiment expected, Experiment updated) {
        AtomicBoolean swapped = new AtomicBoolean();
        experiments.computeIfPresent(expected.testId(), (id, current) -> {
            if (current.version() != expected.version()) {
                return current;
            }
            swapped.set(true);
            return updated;
        });
        return swapped.get();
    }

    @Override
    public Assignment putAssignmentIfAbsent(Assignment assignment) {
        Ledger fresh = new Ledger(assignment);
        Ledger existing = ledgers.computeIfAbsent(assignment.testId(), t -> new ConcurrentHashMap<>())
                .putIfAbsent(assignment.userId(), fresh);
        if (existing != null) {
            return existing.assignment;
        }
        byUser.computeIfAbsent(assignment.userId(), u -> new ConcurrentLinkedQueue<>()).add(assignment);
        byVariant.computeIfAbsent(assignment.testId(), t -> new ConcurrentHashMap<>())
                .computeIfAbsent(assignment.variantId(), v -> new ConcurrentLinkedQueue<>())
                .add(fresh);
        return assignment;
    }

    @Override
    public Optional<Assignment> findAssignment(String testId, String userId) {
        return Optional.ofNullable(ledgers.get(testId))
                .map(perTest -> perTest.get(userId))
                .map(ledger -> ledger.assignment);
    }

    @Override
    public List<Assignment> assignmentsForUser(String userId) {
        Queue<Assignment> assignments = byUser.get(userId);
        if (assignments == null) {
            return List.of();
        }
        List<Assignment> result = new ArrayList<>(assignments);
        result.sort(Comparator.comparing(Assignment::assignedAt));
        return result;
    }

    @Override
    public boolean recordExposure(Assignment assignment, boolean repeatable) throws StoreException {
        Ledger ledger = ledger(assignment);
        return ledger.expose(countersFor(assignment), repeatable);
    }

    @Override
    public boolean recordConversion(Assignment assignment, String goalId, double value, boolean repeatable)
            throws StoreException {
        Ledger ledger = ledger(assignment);
        VariantCounters variantCounters = countersFor(assignment);
        ledger.expose(variantCounters, false);
        boolean first = ledger.converted.add(goalId);
        if (!first && !repeatable) {
            return false;
        }
        ledger.totals.computeIfAbsent(goalId, g -> new DoubleAdder()).add(value);
        variantCounters.converted(goalId, value, first);
        return true;
    }

    @Override
    public void recordMetric(Assignment assignment, String metricName, double value) throws StoreException {
        ledger(assignment);
        countersFor(assignment).measured(metricName, value);
    }

    @Override
    public void appendEvent(ExperimentEvent event) {
        events.computeIfAbsent(event.testId(), t -> new ConcurrentLinkedQueue<>()).add(event);
    }

    @Override
    public List<ExperimentEvent> events(String testId) {
        Queue<ExperimentEvent> queue = events.get(testId);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    @Override
    public VariantStats variantStats(String testId, String variantId) {
        Map<String, VariantCounters> perTest = counters.get(testId);
        VariantCounters variantCounters = perTest == null ? null : perTest.get(variantId);
        return variantCounters == null ? VariantStats.empty(variantId) : variantCounters.snapshot();
    }

    @Override
    public double[] userOutcomes(String testId, String variantId, String goalId) {
        Map<String, Queue<Ledger>> perTest = byVariant.get(testId);
        Queue<Ledger> variantLedgers = perTest == null ? null : perTest.get(variantId);
        if (variantLedgers == null) {
            return new double[0];
        }
        List<Double> outcomes = new ArrayList<>();
        for (Ledger ledger : variantLedgers) {
            if (ledger.exposed) {
                DoubleAdder total = ledger.totals.get(goalId);
                outcomes.add(total == null ? 0.0 : total.sum());
            }
        }
        return outcomes.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private Ledger ledger(Assignment assignment) throws StoreException {
        Map<String, Ledger> perTest = ledgers.get(assignment.testId());
        Ledger ledger = perTest == null ? null : perTest.get(assignment.userId());
        if (ledger == null) {
            throw new StoreException("No stored assignment for user " + assignment.userId()
                    + " in test " + assignment.testId());
        }
        return ledger;
    }

    private VariantCounters countersFor(Assignment assignment) {
        return counters.computeIfAbsent(assignment.testId(), t -> new ConcurrentHashMap<>())
                .computeIfAbsent(assignment.variantId(), VariantCounters::new);
    }

    private static final class Ledger {
        private final Assignment assignment;
        private final Set<String> converted = ConcurrentHashMap.newKeySet();
        private final Map<String, DoubleAdder> totals = new ConcurrentHashMap<>();
        private volatile boolean exposed;

        private Ledger(Assignment assignment) {
            this.assignment = assignment;
        }

        /**
         * Flag and counter move together under the assignment's own monitor, so a concurrent
         * conversion on the same assignment always finds the exposure already counted.
         */
        private synchronized boolean expose(VariantCounters variantCounters, boolean repeatable) {
            if (exposed && !repeatable) {
                return false;
            }
            variantCounters.exposed();
            exposed = true;
            return true;
        }
    }
}
