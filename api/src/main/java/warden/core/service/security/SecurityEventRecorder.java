package warden.core.service.security;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SecurityLogConfig;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventQuery;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.KeyValueStore;
import warden.core.util.StoreJson;

/**
 * Append-only, TTL-bounded audit log of security events.
 *
 * <p>Events are stored one per key under
 * {@code security:logs:{userId|anonymous}:{timestampMillis}}, each with the
 * configured retention as its own TTL. When two events of the same user fall
 * in the same millisecond, the later one takes the next free millisecond slot;
 * the event's own timestamp is unchanged.
 *
 * <p>Recording is best-effort: a store failure is logged and never reaches the
 * caller.
 */
@ApplicationScoped
public class SecurityEventRecorder {

    private static final Logger LOG = Logger.getLogger(SecurityEventRecorder.class);

    static final String KEY_PREFIX = "security:logs:";
    static final String ANONYMOUS = "anonymous";
    private static final int MAX_SLOT_ATTEMPTS = 16;

    private final KeyValueStore store;
    private final SecurityLogConfig config;
    private final Clock clock;

    @Inject
    public SecurityEventRecorder(KeyValueStore store, SecurityLogConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Record an event. Severity is derived from the type and data.
     *
     * @param type event type
     * @param userId affected user, or null for anonymous events
     * @param data event details
     * @return Uni completing once the event is stored or the failure logged
     */
    public Uni<Void> record(SecurityEventType type, String userId, Map<String, Object> data) {
        final var event = new SecurityEvent(
                type, SecurityEventClassifier.classify(type, data), clock.instant(), userId, data);
        logEvent(event);
        return store(event, event.timestamp().toEpochMilli(), 0)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to record security event %s for %s: %s", type, owner(userId), error.getMessage());
                    return null;
                });
    }

    private Uni<Void> store(SecurityEvent event, long slot, int attempt) {
        if (attempt >= MAX_SLOT_ATTEMPTS) {
            return Uni.createFrom()
                    .failure(new IllegalStateException("No free log slot near " + event.timestamp().toEpochMilli()));
        }
        return store.setIfAbsent(key(event.userId(), slot), StoreJson.write(event), config.retention())
                .flatMap(stored -> stored
                        ? Uni.createFrom().voidItem()
                        : store(event, slot + 1, attempt + 1));
    }

    /**
     * Read a user's events, most recent first.
     *
     * @param userId the user, or null for anonymous events
     * @param query filters and page selection
     * @return matching events
     */
    public Uni<List<SecurityEvent>> query(String userId, SecurityEventQuery query) {
        final var prefix = KEY_PREFIX + owner(userId) + ":";
        return store.scan(prefix + "*").flatMap(keys -> {
            final var newestFirst = keys.stream()
                    .sorted(Comparator.comparingLong((String key) -> slotOf(key, prefix)).reversed())
                    .toList();
            if (newestFirst.isEmpty()) {
                return Uni.createFrom().item(List.<SecurityEvent>of());
            }
            List<Uni<Optional<SecurityEvent>>> reads = new ArrayList<>(newestFirst.size());
            for (String key : newestFirst) {
                reads.add(store.get(key).map(json -> json.map(value -> StoreJson.read(value, SecurityEvent.class))));
            }
            return Uni.join().all(reads).andFailFast().map(events -> events.stream()
                    .flatMap(Optional::stream)
                    .filter(query::matches)
                    .skip(query.offset())
                    .limit(query.limit())
                    .toList());
        });
    }

    private void logEvent(SecurityEvent event) {
        final var owner = owner(event.userId());
        if (event.severity() == Severity.INFO) {
            LOG.debugf("Security event %s for %s", event.type(), owner);
        } else if (event.severity() == Severity.WARNING) {
            LOG.infof("Security event %s for %s", event.type(), owner);
        } else {
            LOG.warnf("Security event %s (%s) for %s", event.type(), event.severity(), owner);
        }
    }

    private static long slotOf(String key, String prefix) {
        try {
            return Long.parseLong(key.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return Long.MIN_VALUE;
        }
    }

    static String key(String userId, long slot) {
        return KEY_PREFIX + owner(userId) + ":" + slot;
    }

    private static String owner(String userId) {
        return userId == null ? ANONYMOUS : userId;
    }
}
