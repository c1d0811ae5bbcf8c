package org.javai.experiment.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A controlled test: its definition, lifecycle state and the bookkeeping the engine
 * persists on it (traffic weights for bandits, looks spent for sequential tests).
 *
 * <p>Instances are immutable snapshots. Every {@code with...} copy bumps {@link #version()},
 * which the store uses for compare-and-set updates.
 */
public record Experiment(
        String testId,
        String name,
        String description,
        TestType testType,
        List<Variant> variants,
        TrafficAllocation allocation,
        AudienceSegment audience,
        Goal primaryGoal,
        List<Goal> secondaryGoals,
        Duration plannedDuration,
        long minimumSampleSize,
        StatisticalConfig statistics,
        boolean repeatExposures,
        TestStatus status,
        Instant createdAt,
        Instant activatedAt,
        Instant endsAt,
        Instant concludedAt,
        String owner,
        Set<String> tags,
        String category,
        int looksSpent,
        long version
) {

    public Experiment {
        Objects.requireNonNull(testId, "testId must not be null");
        Objects.requireNonNull(testType, "testType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        variants = variants == null ? List.of() : List.copyOf(variants);
        secondaryGoals = secondaryGoals == null ? List.of() : List.copyOf(secondaryGoals);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        audience = audience == null ? AudienceSegment.everyone() : audience;
        statistics = statistics == null ? StatisticalConfig.defaults() : statistics;
    }

    public Optional<Variant> control() {
        return variants.stream().filter(Variant::control).findFirst();
    }

    public Optional<Variant> variant(String variantId) {
        return variants.stream().filter(v -> v.variantId().equals(variantId)).findFirst();
    }

    public List<Variant> treatments() {
        return variants.stream().filter(v -> !v.control()).toList();
    }

    /**
     * Primary goal first, then secondary goals in definition order.
     */
    public List<Goal> goals() {
        List<Goal> all = new ArrayList<>();
        if (primaryGoal != null) {
            all.add(primaryGoal);
        }
        all.addAll(secondaryGoals);
        return all;
    }

    public Optional<Goal> goal(String goalId) {
        return goals().stream().filter(g -> g.goalId().equals(goalId)).findFirst();
    }

    public Experiment withStatus(TestStatus newStatus) {
        return copy(newStatus, activatedAt, endsAt, concludedAt, allocation, looksSpent);
    }

    public Experiment activated(Instant at) {
        Instant end = plannedDuration == null ? null : at.plus(plannedDuration);
        return copy(TestStatus.RUNNING, at, end, concludedAt, allocation, looksSpent);
    }

    public Experiment concluded(Instant at) {
        return copy(TestStatus.CONCLUDED, activatedAt, endsAt, at, allocation, looksSpent);
    }

    public Experiment withAllocation(TrafficAllocation updated) {
        return copy(status, activatedAt, endsAt, concludedAt, updated, looksSpent);
    }

    public Experiment withLookSpent() {
        return copy(status, activatedAt, endsAt, concludedAt, allocation, looksSpent + 1);
    }

    private Experiment copy(TestStatus newStatus, Instant activated, Instant ends, Instant concluded,
                            TrafficAllocation newAllocation, int looks) {
        return new Experiment(testId, name, description, testType, variants, newAllocation, audience,
                primaryGoal, secondaryGoals, plannedDuration, minimumSampleSize, statistics, repeatExposures,
                newStatus, createdAt, activated, ends, concluded, owner, tags, category, looks, version + 1);
    }
}
