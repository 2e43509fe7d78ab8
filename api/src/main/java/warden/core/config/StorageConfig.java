package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the key-value store backing tokens, sessions
 * and the security log.
 *
 * <p>Configuration prefix: {@code warden.storage}
 */
@ConfigMapping(prefix = "warden.storage")
public interface StorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Built-in providers:
     * <ul>
     *   <li>{@code memory} - single-instance, development and tests</li>
     *   <li>{@code redis} - shared store for multi-instance deployments</li>
     * </ul>
     *
     * @return provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();

    RedisConfig redis();

    MemoryConfig memory();

    interface RedisConfig {

        /**
         * Upper bound for a single Redis command. A timed-out command is
         * reported as a failure with unknown outcome.
         *
         * @return command timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();

        /**
         * {@code COUNT} hint passed to SCAN.
         *
         * @return scan batch size (default: 250)
         */
        @WithDefault("250")
        int scanCount();
    }

    interface MemoryConfig {

        /**
         * How often expired entries are purged.
         *
         * @return cleanup interval (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration cleanupInterval();
    }
}
