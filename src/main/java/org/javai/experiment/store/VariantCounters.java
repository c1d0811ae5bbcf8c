package org.javai.experiment.store;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.javai.experiment.model.GoalStats;
import org.javai.experiment.model.RunningAggregate;
import org.javai.experiment.model.VariantStats;

/**
 * Lock-free counters of one variant. Goals and metrics are independent cells, so writers on
 * different goals of the same variant never contend.
 */
final class VariantCounters {

    private final String variantId;
    private final AtomicLong exposures = new AtomicLong();
    private final Map<String, GoalCell> goals = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<RunningAggregate>> metrics = new ConcurrentHashMap<>();

    VariantCounters(String variantId) {
        this.variantId = variantId;
    }

    void exposed() {
        exposures.incrementAndGet();
    }

    void converted(String goalId, double value, boolean firstForAssignment) {
        GoalCell cell = goals.computeIfAbsent(goalId, id -> new GoalCell());
        if (firstForAssignment) {
            cell.converters.incrementAndGet();
        }
        cell.values.updateAndGet(a -> a.add(value));
    }

    void measured(String metricName, double value) {
        metrics.computeIfAbsent(metricName, name -> new AtomicReference<>(RunningAggregate.EMPTY))
                .updateAndGet(a -> a.add(value));
    }

    VariantStats snapshot() {
        // Conversions before exposures: every conversion is preceded by its exposure.
        Map<String, GoalStats> goalStats = new HashMap<>();
        goals.forEach((goalId, cell) ->
                goalStats.put(goalId, new GoalStats(goalId, cell.converters.get(), cell.values.get())));
        Map<String, RunningAggregate> metricStats = new HashMap<>();
        metrics.forEach((name, ref) -> metricStats.put(name, ref.get()));
        return new VariantStats(variantId, exposures.get(), goalStats, metricStats);
    }

    private static final class GoalCell {
        private final AtomicLong converters = new AtomicLong();
        private final AtomicReference<RunningAggregate> values = new AtomicReference<>(RunningAggregate.EMPTY);
    }
}
