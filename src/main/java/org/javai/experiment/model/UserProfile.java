package org.javai.experiment.model;

import java.util.Map;
import java.util.Objects;

/**
 * The collaborator-supplied user, reduced to what audience targeting reads.
 *
 * @param userId stable user identifier
 * @param attributes targeting attributes (subject, level, locale, ...)
 */
public record UserProfile(String userId, Map<String, PropertyValue> attributes) {

    public UserProfile {
        Objects.requireNonNull(userId, "userId must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static UserProfile of(String userId) {
        return new UserProfile(userId, Map.of());
    }
}
