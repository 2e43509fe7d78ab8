package warden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import warden.core.port.out.KeyValueStore;
import warden.core.service.storage.KeyValueStoreProviderRegistry;

/**
 * CDI producer for the key-value store.
 *
 * <p>Delegates to the {@link KeyValueStoreProviderRegistry}, which selects the
 * provider based on configuration and availability.
 *
 * @see warden.spi.KeyValueStoreProvider
 */
@ApplicationScoped
public class KeyValueStoreProducer {

    private final KeyValueStoreProviderRegistry registry;

    @Inject
    public KeyValueStoreProducer(KeyValueStoreProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public KeyValueStore keyValueStore() {
        return registry.getStore();
    }
}
