package warden.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the shared TTL key-value store.
 *
 * <p>All token, session and security-log state is kept here. Every write
 * carries a TTL so records expire on their own. Only single-key operations
 * are atomic; callers composing several keys must tolerate partial completion.
 *
 * <p>A failed or timed-out write has an unknown outcome and is reported as a
 * failure, never as success.
 */
public interface KeyValueStore {

    /**
     * Store a value, replacing any existing one.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, must be positive
     * @return Uni completing when the value is stored
     */
    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * Store a value only if the key does not exist.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, must be positive
     * @return true if stored, false if the key already existed
     */
    Uni<Boolean> setIfAbsent(String key, String value, Duration ttl);

    /**
     * Read a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Check whether a key exists.
     *
     * @param key the key
     * @return true if the key holds a live value or set
     */
    Uni<Boolean> exists(String key);

    /**
     * Delete a key of either kind.
     *
     * @param key the key
     * @return true if something was deleted
     */
    Uni<Boolean> delete(String key);

    /**
     * List keys matching a glob pattern ({@code *} and {@code ?} wildcards).
     *
     * <p>Implementations must iterate incrementally and never block the store
     * for the whole key space.
     *
     * @param pattern glob pattern, e.g. {@code token:metadata:u1:*}
     * @return matching keys in no particular order
     */
    Uni<List<String>> scan(String pattern);

    /**
     * Add a member to a set, resetting the set's TTL.
     *
     * @param key the set key
     * @param member the member to add
     * @param ttl time to live of the whole set
     * @return Uni completing when the member is added
     */
    Uni<Void> addToSet(String key, String member, Duration ttl);

    /**
     * Read all members of a set.
     *
     * @param key the set key
     * @return members, empty if the set does not exist
     */
    Uni<Set<String>> setMembers(String key);

    /**
     * Remove a member from a set.
     *
     * @param key the set key
     * @param member the member to remove
     * @return true if the member was present
     */
    Uni<Boolean> removeFromSet(String key, String member);
}
