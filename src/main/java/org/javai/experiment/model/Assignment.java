package org.javai.experiment.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The sticky mapping of one user to one variant of one test. Created once, never rewritten.
 *
 * @param testId the test
 * @param userId the user
 * @param variantId the assigned arm
 * @param assignedAt when the assignment was made
 * @param profile the user profile snapshot eligibility was decided on
 * @param session session context at assignment
 * @param device device context at assignment
 */
public record Assignment(
        String testId,
        String userId,
        String variantId,
        Instant assignedAt,
        UserProfile profile,
        SessionInfo session,
        DeviceInfo device
) {

    public Assignment {
        Objects.requireNonNull(testId, "testId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(variantId, "variantId must not be null");
        Objects.requireNonNull(assignedAt, "assignedAt must not be null");
    }

}
