package warden.core.service.user;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.UserCacheConfig;
import warden.core.model.user.UserInfo;
import warden.core.port.out.KeyValueStore;
import warden.core.port.out.UserRepository;
import warden.core.util.StoreJson;

/**
 * Read-through cache of {@link UserInfo} at {@code user:auth:{userId}}.
 *
 * <p>The cache lives in the shared store, so every instance sees the same
 * entry and an invalidation takes effect everywhere. Cache failures are
 * treated as misses; they never fail the caller.
 */
@ApplicationScoped
public class UserInfoCache {

    private static final Logger LOG = Logger.getLogger(UserInfoCache.class);

    static final String KEY_PREFIX = "user:auth:";

    private final KeyValueStore store;
    private final UserRepository userRepository;
    private final UserCacheConfig config;

    @Inject
    public UserInfoCache(KeyValueStore store, UserRepository userRepository, UserCacheConfig config) {
        this.store = store;
        this.userRepository = userRepository;
        this.config = config;
    }

    /**
     * Return the user's info from the cache, loading and caching it on a miss.
     *
     * @param userId the user
     * @return user info, or empty if the user does not exist
     */
    public Uni<Optional<UserInfo>> getOrLoad(String userId) {
        if (!config.enabled()) {
            return load(userId);
        }
        return cached(userId).flatMap(hit -> {
            if (hit.isPresent()) {
                LOG.debugf("User info cache hit: %s", userId);
                return Uni.createFrom().item(hit);
            }
            return load(userId).call(loaded -> loaded.map(this::put).orElseGet(() -> Uni.createFrom().voidItem()));
        });
    }

    /**
     * Cache a user's info.
     *
     * @param info the info
     * @return Uni completing when stored or the failure logged
     */
    public Uni<Void> put(UserInfo info) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return store.set(key(info.userId()), StoreJson.write(info), config.ttl())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to cache user info for %s: %s", info.userId(), error.getMessage());
                    return null;
                });
    }

    /**
     * Drop a user's cached info.
     *
     * @param userId the user
     * @return Uni completing when removed or the failure logged
     */
    public Uni<Void> invalidate(String userId) {
        return store.delete(key(userId))
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to invalidate cached user info for %s: %s", userId, error.getMessage());
                    return null;
                });
    }

    private Uni<Optional<UserInfo>> cached(String userId) {
        return store.get(key(userId))
                .map(json -> json.map(value -> StoreJson.read(value, UserInfo.class)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("User info cache read failed for %s: %s", userId, error.getMessage());
                    return Optional.empty();
                });
    }

    private Uni<Optional<UserInfo>> load(String userId) {
        return userRepository.findById(userId).map(user -> user.map(UserInfo::of));
    }

    static String key(String userId) {
        return KEY_PREFIX + userId;
    }
}
