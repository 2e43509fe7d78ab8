package warden.core.model.session;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Partial update applied to a session record.
 *
 * <p>Setting {@code accessedAt} re-extends the session's expiry from that instant.
 *
 * @param accessedAt new last-access time (optional)
 * @param data       attributes merged into the session data (optional)
 */
public record SessionUpdate(Optional<Instant> accessedAt, Optional<Map<String, Object>> data) {

    public SessionUpdate {
        accessedAt = accessedAt == null ? Optional.empty() : accessedAt;
        data = data == null ? Optional.empty() : data;
    }

    public static SessionUpdate touch(Instant accessedAt) {
        return new SessionUpdate(Optional.of(accessedAt), Optional.empty());
    }

    public static SessionUpdate data(Map<String, Object> data) {
        return new SessionUpdate(Optional.empty(), Optional.of(data));
    }
}
