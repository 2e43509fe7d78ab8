package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the user info cache.
 *
 * <p>Configuration prefix: {@code warden.user-cache}
 */
@ConfigMapping(prefix = "warden.user-cache")
public interface UserCacheConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * @return cache entry TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration ttl();
}
