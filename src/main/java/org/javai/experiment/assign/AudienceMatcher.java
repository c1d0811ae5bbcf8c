package org.javai.experiment.assign;

import java.util.List;
import java.util.Optional;

import org.javai.experiment.model.AudienceSegment;
import org.javai.experiment.model.DeviceInfo;
import org.javai.experiment.model.ExclusionGroup;
import org.javai.experiment.model.PropertyValue;
import org.javai.experiment.model.SegmentCriterion;
import org.javai.experiment.model.SessionInfo;
import org.javai.experiment.model.UserProfile;

/**
 * Evaluates audience targeting against the context a collaborator supplied.
 *
 * <p>Field paths:
 * <ul>
 *   <li>{@code profile.userId}, {@code profile.<attribute>}</li>
 *   <li>{@code session.sessionId}, {@code session.startTime}, {@code session.referrer},
 *       {@code session.userAgent}, {@code session.landingPage}</li>
 *   <li>{@code device.type}, {@code device.operatingSystem}, {@code device.browser},
 *       {@code device.timezone}</li>
 * </ul>
 * A path without a known root is read as a profile attribute.
 */
public class AudienceMatcher {

    public boolean matches(AudienceSegment segment, UserProfile profile, SessionInfo session, DeviceInfo device) {
        Context context = new Context(profile, session, device);
        if (!allMatch(segment.criteria(), context)) {
            return false;
        }
        for (ExclusionGroup group : segment.exclusions()) {
            if (!group.criteria().isEmpty() && allMatch(group.criteria(), context)) {
                return false;
            }
        }
        return true;
    }

    boolean matches(SegmentCriterion criterion, UserProfile profile, SessionInfo session, DeviceInfo device) {
        return evaluate(criterion, new Context(profile, session, device));
    }

    private boolean allMatch(List<SegmentCriterion> criteria, Context context) {
        for (SegmentCriterion criterion : criteria) {
            if (!evaluate(criterion, context)) {
                return false;
            }
        }
        return true;
    }

    private boolean evaluate(SegmentCriterion criterion, Context context) {
        Optional<PropertyValue> actual = context.resolve(criterion.field());
        PropertyValue operand = criterion.operand();
        return switch (criterion.operator()) {
            case EXISTS -> actual.isPresent();
            case EQUALS -> actual.isPresent() && operand != null && same(actual.get(), operand);
            case NOT_EQUALS -> actual.isEmpty() || operand == null || !same(actual.get(), operand);
            case IN -> actual.isPresent() && anySame(actual.get(), criterion.operands());
            case NOT_IN -> actual.isEmpty() || !anySame(actual.get(), criterion.operands());
            case CONTAINS -> actual.isPresent() && operand != null
                    && actual.get().asText().contains(operand.asText());
            case GREATER_THAN -> actual.isPresent() && operand != null
                    && actual.get().asNumber() > operand.asNumber();
            case LESS_THAN -> actual.isPresent() && operand != null
                    && actual.get().asNumber() < operand.asNumber();
        };
    }

    private static boolean anySame(PropertyValue actual, List<PropertyValue> candidates) {
        for (PropertyValue candidate : candidates) {
            if (same(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Numbers compare numerically, everything else by text.
     */
    private static boolean same(PropertyValue a, PropertyValue b) {
        if (a instanceof PropertyValue.NumberValue && b instanceof PropertyValue.NumberValue) {
            return Double.compare(a.asNumber(), b.asNumber()) == 0;
        }
        return a.asText().equals(b.asText());
    }

    private record Context(UserProfile profile, SessionInfo session, DeviceInfo device) {

        Optional<PropertyValue> resolve(String field) {
            int dot = field.indexOf('.');
            String root = dot < 0 ? "" : field.substring(0, dot);
            String rest = dot < 0 ? field : field.substring(dot + 1);
            return switch (root) {
                case "profile" -> profileField(rest);
                case "session" -> sessionField(rest);
                case "device" -> deviceField(rest);
                default -> profileField(field);
            };
        }

        private Optional<PropertyValue> profileField(String name) {
            if (profile == null) {
                return Optional.empty();
            }
            if (name.equals("userId")) {
                return Optional.of(PropertyValue.of(profile.userId()));
            }
            return Optional.ofNullable(profile.attributes().get(name));
        }

        private Optional<PropertyValue> sessionField(String name) {
            if (session == null) {
                return Optional.empty();
            }
            return switch (name) {
                case "sessionId" -> text(session.sessionId());
                case "startTime" -> Optional.ofNullable(session.startTime()).map(PropertyValue::of);
                case "referrer" -> text(session.referrer());
                case "userAgent" -> text(session.userAgent());
                case "landingPage" -> text(session.landingPage());
                default -> Optional.empty();
            };
        }

        private Optional<PropertyValue> deviceField(String name) {
            if (device == null) {
                return Optional.empty();
            }
            return switch (name) {
                case "type" -> Optional.ofNullable(device.type()).map(t -> PropertyValue.of(t.name()));
                case "operatingSystem" -> text(device.operatingSystem());
                case "browser" -> text(device.browser());
                case "timezone" -> text(device.timezone());
                default -> Optional.empty();
            };
        }

        private static Optional<PropertyValue> text(String value) {
            return Optional.ofNullable(value).map(PropertyValue::of);
        }
    }
}
