package warden.spi;

import warden.core.port.out.KeyValueStore;

/**
 * SPI for key-value store backends.
 *
 * <p>Platform teams can implement this interface and expose it as a CDI bean
 * to back tokens, sessions and the security log with another store.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - shared Redis store</li>
 *   <li>memory (priority: 0) - in-process store (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code warden.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
public interface KeyValueStoreProvider {

    /**
     * Return the provider name used in {@code warden.storage.provider}.
     *
     * @return provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the store. Called once, after selection.
     *
     * @return store instance
     */
    KeyValueStore createStore();
}
