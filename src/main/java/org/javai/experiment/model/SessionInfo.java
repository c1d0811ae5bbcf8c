package org.javai.experiment.model;

import java.time.Instant;

/**
 * Session context captured at assignment time. All fields except the id are optional.
 */
public record SessionInfo(
        String sessionId,
        Instant startTime,
        String referrer,
        String userAgent,
        String landingPage
) {

    public static SessionInfo anonymous() {
        return new SessionInfo(null, null, null, null, null);
    }
}
