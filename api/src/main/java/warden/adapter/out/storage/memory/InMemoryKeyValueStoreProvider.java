package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.port.out.KeyValueStore;
import warden.spi.KeyValueStoreProvider;

/**
 * In-memory key-value store provider.
 *
 * <p>This provider is always available and serves as the fallback when
 * Redis is not configured or not reachable.
 *
 * <p><strong>Warning:</strong> revocations, sessions and lockout-related
 * security logs are not shared between instances. Not for production use.
 */
@ApplicationScoped
public class InMemoryKeyValueStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStoreProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private final StorageConfig config;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemoryKeyValueStore store;

    @Inject
    public InMemoryKeyValueStoreProvider(Clock clock, StorageConfig config) {
        this.clock = clock;
        this.config = config;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Token, session and security-log storage is in-memory only!");
            LOG.warn("  A token revoked on one instance stays valid on every other instance.");
            LOG.warn("  Configure warden.storage.provider=redis for multi-instance deployments.");
            LOG.warn("========================================================================");
        }
        if (store == null) {
            store = new InMemoryKeyValueStore(clock, config.memory().cleanupInterval());
        }
        return store;
    }

    @PreDestroy
    synchronized void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
