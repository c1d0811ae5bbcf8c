package org.javai.experiment.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One targeting rule: a dotted field path, an operator and its operands.
 *
 * <p>Paths are rooted at {@code profile}, {@code session} or {@code device}, for example
 * {@code profile.level}, {@code session.referrer}, {@code device.type}.
 *
 * @param field dotted path to the value under test
 * @param operator the comparison
 * @param operands operand list; one element for scalar operators, any number for IN / NOT_IN,
 *                 none for EXISTS
 */
public record SegmentCriterion(String field, CriterionOperator operator, List<PropertyValue> operands) {

    public SegmentCriterion {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        operands = operands == null ? List.of() : List.copyOf(operands);
    }

    public static SegmentCriterion equalTo(String field, PropertyValue value) {
        return new SegmentCriterion(field, CriterionOperator.EQUALS, List.of(value));
    }

    public static SegmentCriterion notEqualTo(String field, PropertyValue value) {
        return new SegmentCriterion(field, CriterionOperator.NOT_EQUALS, List.of(value));
    }

    public static SegmentCriterion in(String field, PropertyValue... values) {
        return new SegmentCriterion(field, CriterionOperator.IN, Arrays.asList(values));
    }

    public static SegmentCriterion notIn(String field, PropertyValue... values) {
        return new SegmentCriterion(field, CriterionOperator.NOT_IN, Arrays.asList(values));
    }

    public static SegmentCriterion contains(String field, String fragment) {
        return new SegmentCriterion(field, CriterionOperator.CONTAINS, List.of(PropertyValue.of(fragment)));
    }

    public static SegmentCriterion greaterThan(String field, double bound) {
        return new SegmentCriterion(field, CriterionOperator.GREATER_THAN, List.of(PropertyValue.of(bound)));
    }

    public static SegmentCriterion lessThan(String field, double bound) {
        return new SegmentCriterion(field, CriterionOperator.LESS_THAN, List.of(PropertyValue.of(bound)));
    }

    public static SegmentCriterion exists(String field) {
        return new SegmentCriterion(field, CriterionOperator.EXISTS, List.of());
    }

    /**
     * The first operand, for scalar operators.
     */
    public PropertyValue operand() {
        return operands.isEmpty() ? null : operands.get(0);
    }
}
