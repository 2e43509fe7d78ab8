package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import warden.core.port.out.KeyValueStore;

/**
 * Redis implementation of KeyValueStore.
 *
 * <p>Values are Redis strings written with millisecond TTLs ({@code PSETEX},
 * {@code SET ... NX PX}); sets are Redis sets whose TTL is reset on every add.
 * Pattern listing uses {@code SCAN} rather than {@code KEYS} so large key spaces
 * are walked incrementally.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final ReactiveRedisDataSource dataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final int scanCount;

    public RedisKeyValueStore(ReactiveRedisDataSource dataSource, RedisTimeoutHelper timeoutHelper, int scanCount) {
        this.dataSource = dataSource;
        this.valueCommands = dataSource.value(String.class, String.class);
        this.keyCommands = dataSource.key(String.class);
        this.setCommands = dataSource.set(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
        this.scanCount = scanCount;
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        var operation = valueCommands.psetex(key, ttlMillis(ttl), value);
        return timeoutHelper.withTimeout(operation, "set");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        // SET NX replies OK when written and nil when the key already exists
        var operation = dataSource
                .execute("SET", key, value, "NX", "PX", String.valueOf(ttlMillis(ttl)))
                .map(response -> response != null);
        return timeoutHelper.withTimeout(operation, "setIfAbsent");
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        var operation = valueCommands.get(key).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return timeoutHelper.withTimeout(keyCommands.exists(key), "exists");
    }

    @Override
    public Uni<Boolean> delete(String key) {
        var operation = keyCommands.del(key).map(deleted -> deleted > 0);
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<List<String>> scan(String pattern) {
        var operation = keyCommands
                .scan(new KeyScanArgs().match(pattern).count(scanCount))
                .toMulti()
                .collect()
                .asList();
        return timeoutHelper.withTimeout(operation, "scan");
    }

    @Override
    public Uni<Void> addToSet(String key, String member, Duration ttl) {
        var operation = setCommands
                .sadd(key, member)
                .flatMap(added -> keyCommands.pexpire(key, ttl))
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "addToSet");
    }

    @Override
    public Uni<Set<String>> setMembers(String key) {
        return timeoutHelper.withTimeout(setCommands.smembers(key), "setMembers");
    }

    @Override
    public Uni<Boolean> removeFromSet(String key, String member) {
        var operation = setCommands.srem(key, member).map(removed -> removed > 0);
        return timeoutHelper.withTimeout(operation, "removeFromSet");
    }

    private static long ttlMillis(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
        return ttl.toMillis();
    }
}
