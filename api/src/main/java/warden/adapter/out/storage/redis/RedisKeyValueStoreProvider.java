package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.KeyValueStore;
import warden.spi.KeyValueStoreProvider;

/**
 * Redis-based key-value store provider.
 *
 * <p>This is the recommended provider for production deployments: every
 * instance sees the same revocations, sessions and security log.
 */
@ApplicationScoped
public class RedisKeyValueStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueStoreProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final StorageConfig config;
    private final AuthMetrics metrics;

    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);
    private RedisKeyValueStore store;

    @Inject
    public RedisKeyValueStoreProvider(
            ReactiveRedisDataSource redisDataSource, StorageConfig config, AuthMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        if (!"redis".equals(config.provider())) {
            LOG.debug("Redis storage not selected, skipping availability check");
            checkLatch.countDown();
            return;
        }
        redisDataSource
                .key(String.class)
                .exists("warden:connection-check")
                .ifNoItem()
                .after(AVAILABILITY_CHECK_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis key-value store is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis key-value store is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(AVAILABILITY_CHECK_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (store == null) {
            final var redis = config.redis();
            final var timeoutHelper = new RedisTimeoutHelper(redis.timeout(), metrics, "redis-kv");
            store = new RedisKeyValueStore(redisDataSource, timeoutHelper, redis.scanCount());
            LOG.infof("Created Redis key-value store (timeout: %s)", redis.timeout());
        }
        return store;
    }
}
