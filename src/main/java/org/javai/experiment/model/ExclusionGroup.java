package org.javai.experiment.model;

import java.util.List;
import java.util.Objects;

/**
 * Users matching every criterion of the group are kept out of the test.
 */
public record ExclusionGroup(String reason, List<SegmentCriterion> criteria) {

    public ExclusionGroup {
        Objects.requireNonNull(reason, "reason must not be null");
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }
}
