package org.javai.experiment.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to create a test. Built with {@link #builder(String)}; validated by the
 * lifecycle controller before any state changes.
 */
public final class ExperimentConfig {

    private final String name;
    private final String description;
    private final TestType testType;
    private final List<Variant> variants;
    private final TrafficAllocation allocation;
    private final AudienceSegment audience;
    private final Goal primaryGoal;
    private final List<Goal> secondaryGoals;
    private final Duration plannedDuration;
    private final long minimumSampleSize;
    private final StatisticalConfig statistics;
    private final boolean repeatExposures;
    private final String owner;
    private final Set<String> tags;
    private final String category;

    private ExperimentConfig(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.testType = b.testType;
        this.variants = List.copyOf(b.variants);
        this.allocation = b.allocation;
        this.audience = b.audience;
        this.primaryGoal = b.primaryGoal;
        this.secondaryGoals = List.copyOf(b.secondaryGoals);
        this.plannedDuration = b.plannedDuration;
        this.minimumSampleSize = b.minimumSampleSize;
        this.statistics = b.statistics;
        this.repeatExposures = b.repeatExposures;
        this.owner = b.owner;
        this.tags = Set.copyOf(b.tags);
        this.category = b.category;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Materialises a draft experiment from this configuration.
     */
    public Experiment toExperiment(String testId, Instant createdAt) {
        return new Experiment(testId, name, description, testType, variants, allocation, audience,
                primaryGoal, secondaryGoals, plannedDuration, minimumSampleSize, statistics, repeatExposures,
                TestStatus.DRAFT, createdAt, null, null, null, owner, tags, category, 0, 0L);
    }

    public String name() {
        return name;
    }

    public TestType testType() {
        return testType;
    }

    public List<Variant> variants() {
        return variants;
    }

    public TrafficAllocation allocation() {
        return allocation;
    }

    public AudienceSegment audience() {
        return audience;
    }

    public Goal primaryGoal() {
        return primaryGoal;
    }

    public List<Goal> secondaryGoals() {
        return secondaryGoals;
    }

    public long minimumSampleSize() {
        return minimumSampleSize;
    }

    public StatisticalConfig statistics() {
        return statistics;
    }

    public Duration plannedDuration() {
        return plannedDuration;
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private TestType testType = TestType.SIMPLE_AB;
        private final List<Variant> variants = new ArrayList<>();
        private TrafficAllocation allocation;
        private AudienceSegment audience = AudienceSegment.everyone();
        private Goal primaryGoal;
        private final List<Goal> secondaryGoals = new ArrayList<>();
        private Duration plannedDuration = Duration.ofDays(14);
        private long minimumSampleSize = 100;
        private StatisticalConfig statistics = StatisticalConfig.defaults();
        private boolean repeatExposures;
        private String owner = "unknown";
        private final Set<String> tags = new LinkedHashSet<>();
        private String category = "general";

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder testType(TestType testType) {
            this.testType = Objects.requireNonNull(testType);
            return this;
        }

        public Builder variant(Variant variant) {
            this.variants.add(Objects.requireNonNull(variant));
            return this;
        }

        public Builder allocation(TrafficAllocation allocation) {
            this.allocation = allocation;
            return this;
        }

        public Builder audience(AudienceSegment audience) {
            this.audience = audience;
            return this;
        }

        public Builder primaryGoal(Goal goal) {
            this.primaryGoal = goal;
            return this;
        }

        public Builder secondaryGoal(Goal goal) {
            this.secondaryGoals.add(Objects.requireNonNull(goal));
            return this;
        }

        public Builder plannedDuration(Duration plannedDuration) {
            this.plannedDuration = plannedDuration;
            return this;
        }

        public Builder minimumSampleSize(long minimumSampleSize) {
            this.minimumSampleSize = minimumSampleSize;
            return this;
        }

        public Builder statistics(StatisticalConfig statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder repeatExposures(boolean repeatExposures) {
            this.repeatExposures = repeatExposures;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public ExperimentConfig build() {
            return new ExperimentConfig(this);
        }
    }
}
