package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenConfig;
import warden.core.model.auth.AuthException;
import warden.core.model.session.SessionRecord;
import warden.core.model.session.SessionUpdate;
import warden.core.port.in.SessionManagement.SessionCreationException;
import warden.core.port.out.KeyValueStore;
import warden.core.util.StoreJson;

/**
 * Session records keyed by opaque id, plus a per-user index.
 *
 * <h2>Key Structure</h2>
 * <ul>
 *   <li>{@code session:{sessionId}} - JSON session record, TTL = refresh token lifetime</li>
 *   <li>{@code session:byUser:{userId}} - set of the user's session ids</li>
 * </ul>
 *
 * <p>A record never lives longer than the refresh token minted with it:
 * creation and every touch set {@code expiresAt} to the access time plus the
 * refresh token lifetime, and the store TTL to the same instant.
 *
 * <p>Record and index writes are separate store calls. The index may briefly
 * hold ids whose record is gone; those are pruned when the index is read.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    static final String KEY_PREFIX = "session:";
    static final String USER_INDEX_PREFIX = "session:byUser:";
    private static final int MAX_ID_ATTEMPTS = 3;

    private final KeyValueStore store;
    private final SessionIdGenerator idGenerator;
    private final Duration sessionTtl;
    private final Clock clock;

    @Inject
    public SessionStore(KeyValueStore store, SessionIdGenerator idGenerator, TokenConfig config, Clock clock) {
        this(store, idGenerator, config.refreshTtl(), clock);
    }

    public SessionStore(KeyValueStore store, SessionIdGenerator idGenerator, Duration sessionTtl, Clock clock) {
        this.store = store;
        this.idGenerator = idGenerator;
        this.sessionTtl = sessionTtl;
        this.clock = clock;
    }

    /**
     * Create a session.
     *
     * @param userId owning user
     * @param data session attributes
     * @param ipAddress client IP (may be null)
     * @param userAgent client user agent (may be null)
     * @return the new session id
     * @throws SessionCreationException if no unused id was found
     */
    public Uni<String> create(String userId, Map<String, Object> data, String ipAddress, String userAgent) {
        // Whole seconds, matching token iat/exp precision
        final var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return createWithRetry(userId, data, ipAddress, userAgent, now, 0);
    }

    private Uni<String> createWithRetry(
            String userId, Map<String, Object> data, String ipAddress, String userAgent, Instant now, int attempt) {
        if (attempt >= MAX_ID_ATTEMPTS) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + MAX_ID_ATTEMPTS + " attempts"));
        }

        final var sessionId = idGenerator.generate();
        final var record =
                new SessionRecord(sessionId, userId, now, now, now.plus(sessionTtl), ipAddress, userAgent, data);

        return store.setIfAbsent(key(sessionId), StoreJson.write(record), sessionTtl)
                .flatMap(saved -> {
                    if (!saved) {
                        LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, MAX_ID_ATTEMPTS);
                        return createWithRetry(userId, data, ipAddress, userAgent, now, attempt + 1);
                    }
                    return store.addToSet(userIndexKey(userId), sessionId, sessionTtl)
                            .invoke(() -> LOG.debugf("Session created: %s for user %s", sessionId, userId))
                            .replaceWith(sessionId);
                });
    }

    /**
     * Load a session.
     *
     * @param sessionId session id
     * @return the record
     * @throws AuthException.SessionNotFound if absent or expired
     */
    public Uni<SessionRecord> get(String sessionId) {
        return find(sessionId).map(found -> found.orElseThrow(() -> new AuthException.SessionNotFound(sessionId)));
    }

    /**
     * Load a session if it exists.
     *
     * @param sessionId session id
     * @return the record, or empty if absent or expired
     */
    public Uni<Optional<SessionRecord>> find(String sessionId) {
        return store.get(key(sessionId)).map(json -> json.map(value -> StoreJson.read(value, SessionRecord.class))
                .filter(record -> !record.isExpired(clock.instant())));
    }

    /**
     * Apply a partial update. Touching the session re-extends its expiry to
     * the access time plus the refresh token lifetime.
     *
     * @param sessionId session id
     * @param update fields to change
     * @return the updated record
     * @throws AuthException.SessionNotFound if absent or expired
     */
    public Uni<SessionRecord> update(String sessionId, SessionUpdate update) {
        return get(sessionId).flatMap(existing -> {
            var updated = existing;
            if (update.data().isPresent()) {
                updated = updated.withMergedData(update.data().get());
            }
            if (update.accessedAt().isPresent()) {
                final var accessedAt = update.accessedAt().get();
                updated = updated.withAccess(accessedAt, accessedAt.plus(sessionTtl));
            }
            final var remaining = Duration.between(clock.instant(), updated.expiresAt());
            if (remaining.isZero() || remaining.isNegative()) {
                return Uni.createFrom().failure(new AuthException.SessionNotFound(sessionId));
            }
            final var result = updated;
            return store.set(key(sessionId), StoreJson.write(result), remaining)
                    .flatMap(v -> update.accessedAt().isPresent()
                            ? store.addToSet(userIndexKey(result.userId()), sessionId, remaining)
                            : Uni.createFrom().voidItem())
                    .replaceWith(result);
        });
    }

    /**
     * Delete a session and drop it from its user's index.
     *
     * @param sessionId session id
     * @return true if a live session was deleted
     */
    public Uni<Boolean> delete(String sessionId) {
        return find(sessionId).flatMap(found -> store.delete(key(sessionId)).flatMap(deleted -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            return store.removeFromSet(userIndexKey(found.get().userId()), sessionId)
                    .invoke(() -> LOG.debugf("Session deleted: %s", sessionId))
                    .replaceWith(deleted);
        }));
    }

    /**
     * List the ids of a user's live sessions. Index entries whose record has
     * expired are removed.
     *
     * @param userId the user
     * @return live session ids
     */
    public Uni<List<String>> findByUser(String userId) {
        return findRecordsByUser(userId).map(records -> records.stream().map(SessionRecord::sessionId).toList());
    }

    /**
     * Load a user's live session records.
     *
     * @param userId the user
     * @return live records, in no particular order
     */
    public Uni<List<SessionRecord>> findRecordsByUser(String userId) {
        final var indexKey = userIndexKey(userId);
        return store.setMembers(indexKey).flatMap(ids -> {
            if (ids.isEmpty()) {
                return Uni.createFrom().item(List.<SessionRecord>of());
            }
            List<Uni<Optional<SessionRecord>>> lookups = new ArrayList<>(ids.size());
            for (String id : ids) {
                lookups.add(find(id).call(found -> found.isPresent()
                        ? Uni.createFrom().voidItem()
                        : store.removeFromSet(indexKey, id)));
            }
            return Uni.join().all(lookups).andFailFast().map(found -> found.stream()
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    /**
     * Delete every session of a user, then the index itself.
     *
     * @param userId the user
     * @return number of session records deleted
     */
    public Uni<Integer> deleteAllForUser(String userId) {
        final var indexKey = userIndexKey(userId);
        return store.setMembers(indexKey).flatMap(ids -> {
            if (ids.isEmpty()) {
                return store.delete(indexKey).replaceWith(0);
            }
            List<Uni<Boolean>> deletions = new ArrayList<>(ids.size());
            for (String id : ids) {
                deletions.add(store.delete(key(id)));
            }
            return Uni.join().all(deletions).andCollectFailures().flatMap(results -> {
                final var deleted = (int) results.stream().filter(Boolean::booleanValue).count();
                LOG.infof("Deleted %d session(s) for user %s", deleted, userId);
                return store.delete(indexKey).replaceWith(deleted);
            });
        });
    }

    public Duration sessionTtl() {
        return sessionTtl;
    }

    static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    static String userIndexKey(String userId) {
        return USER_INDEX_PREFIX + userId;
    }
}
