package org.javai.experiment.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Targeting predicate of a test: a user is eligible when all criteria match and
 * no exclusion group matches.
 */
public record AudienceSegment(
        String segmentId,
        String name,
        List<SegmentCriterion> criteria,
        List<ExclusionGroup> exclusions
) {

    public AudienceSegment {
        Objects.requireNonNull(segmentId, "segmentId must not be null");
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
    }

    /**
     * A segment that admits every user.
     */
    public static AudienceSegment everyone() {
        return new AudienceSegment("everyone", "Everyone", List.of(), List.of());
    }

    public static AudienceSegment of(String segmentId, SegmentCriterion... criteria) {
        return new AudienceSegment(segmentId, segmentId, List.of(criteria), List.of());
    }

    public AudienceSegment excluding(ExclusionGroup group) {
        List<ExclusionGroup> all = new ArrayList<>(exclusions);
        all.add(group);
        return new AudienceSegment(segmentId, name, criteria, all);
    }
}
