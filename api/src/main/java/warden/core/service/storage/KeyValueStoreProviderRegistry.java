package warden.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.port.out.KeyValueStore;
import warden.spi.KeyValueStoreProvider;

/**
 * Registry for key-value store providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code warden.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class KeyValueStoreProviderRegistry {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreProviderRegistry.class);

    private final Instance<KeyValueStoreProvider> providers;
    private final StorageConfig config;

    private KeyValueStoreProvider selectedProvider;
    private KeyValueStore store;

    @Inject
    public KeyValueStoreProviderRegistry(Instance<KeyValueStoreProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup, on a worker thread, so the first
     * request never waits on the Redis availability check.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Key-value store provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the store from the selected provider.
     *
     * @return key-value store
     */
    public synchronized KeyValueStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore();
        }
        return store;
    }

    /**
     * Get the selected provider.
     *
     * @return selected provider
     */
    public synchronized KeyValueStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider(providers.stream().toList(), config.provider());
        }
        return selectedProvider;
    }

    static KeyValueStoreProvider selectProvider(List<KeyValueStoreProvider> candidates, String configuredProvider) {
        final var availableProviders = candidates.stream()
                .filter(KeyValueStoreProvider::isAvailable)
                .sorted(Comparator.comparingInt(KeyValueStoreProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available key-value store providers: %s",
                availableProviders.stream().map(KeyValueStoreProvider::name).toList());

        Optional<KeyValueStoreProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured key-value store provider: %s", configuredProvider);
            return configured.get();
        }

        if (!"memory".equals(configuredProvider)) {
            LOG.warnf("Configured key-value store provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using key-value store provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No key-value store providers available");
    }
}
