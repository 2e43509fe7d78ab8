package warden.core.model.session;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Server-side record of one authenticated device or browser.
 *
 * @param sessionId      opaque session id
 * @param userId         owning user
 * @param createdAt      creation time
 * @param lastAccessedAt last token refresh (or creation)
 * @param expiresAt      absolute expiry, bounded by the refresh token lifetime
 * @param ipAddress      client IP at creation (may be null)
 * @param userAgent      client user agent at creation (may be null)
 * @param data           free-form session attributes
 */
public record SessionRecord(
        String sessionId,
        String userId,
        Instant createdAt,
        Instant lastAccessedAt,
        Instant expiresAt,
        String ipAddress,
        String userAgent,
        Map<String, Object> data) {

    public SessionRecord {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be null or blank");
        }
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public SessionRecord withAccess(Instant lastAccessedAt, Instant expiresAt) {
        return new SessionRecord(sessionId, userId, createdAt, lastAccessedAt, expiresAt, ipAddress, userAgent, data);
    }

    /**
     * Returns a copy whose data is this record's data overlaid with {@code additions}.
     */
    public SessionRecord withMergedData(Map<String, Object> additions) {
        Map<String, Object> merged = new HashMap<>(data);
        merged.putAll(additions);
        return new SessionRecord(sessionId, userId, createdAt, lastAccessedAt, expiresAt, ipAddress, userAgent, merged);
    }
}
