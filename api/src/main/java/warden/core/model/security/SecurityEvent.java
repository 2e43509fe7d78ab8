package warden.core.model.security;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit record of a security-relevant state change.
 *
 * @param type      event type
 * @param severity  severity assigned by classification
 * @param timestamp when the event was recorded
 * @param userId    affected user, or null for anonymous events
 * @param data      event details
 */
public record SecurityEvent(
        SecurityEventType type, Severity severity, Instant timestamp, String userId, Map<String, Object> data) {

    public SecurityEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
