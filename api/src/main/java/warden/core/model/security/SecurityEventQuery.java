package warden.core.model.security;

import java.time.Instant;
import java.util.Set;

/**
 * Filter and page selection for reading a user's security log.
 *
 * @param limit maximum number of events returned
 * @param offset number of matching events skipped
 * @param types event types to include; empty means all
 * @param from inclusive lower bound on timestamp (may be null)
 * @param to inclusive upper bound on timestamp (may be null)
 */
public record SecurityEventQuery(int limit, int offset, Set<SecurityEventType> types, Instant from, Instant to) {

    public static final int DEFAULT_LIMIT = 50;

    public SecurityEventQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
        types = types == null ? Set.of() : Set.copyOf(types);
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
    }

    public static SecurityEventQuery latest(int limit) {
        return new SecurityEventQuery(limit, 0, Set.of(), null, null);
    }

    public SecurityEventQuery withOffset(int offset) {
        return new SecurityEventQuery(limit, offset, types, from, to);
    }

    public SecurityEventQuery withTypes(Set<SecurityEventType> types) {
        return new SecurityEventQuery(limit, offset, types, from, to);
    }

    public SecurityEventQuery between(Instant from, Instant to) {
        return new SecurityEventQuery(limit, offset, types, from, to);
    }

    /**
     * Returns true if the event passes the type and time filters.
     */
    public boolean matches(SecurityEvent event) {
        if (!types.isEmpty() && !types.contains(event.type())) {
            return false;
        }
        if (from != null && event.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || !event.timestamp().isAfter(to);
    }
}
