package warden.core.model.session;

import java.time.Instant;

/**
 * Listing view of one of a user's sessions.
 */
public record SessionSummary(
        String sessionId,
        String ipAddress,
        String userAgent,
        Instant createdAt,
        Instant lastAccessedAt,
        Instant expiresAt,
        boolean current) {

    public static SessionSummary of(SessionRecord record, String currentSessionId) {
        return new SessionSummary(
                record.sessionId(),
                record.ipAddress(),
                record.userAgent(),
                record.createdAt(),
                record.lastAccessedAt(),
                record.expiresAt(),
                record.sessionId().equals(currentSessionId));
    }
}
