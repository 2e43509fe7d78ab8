package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the security event log.
 *
 * <p>Configuration prefix: {@code warden.security-log}
 */
@ConfigMapping(prefix = "warden.security-log")
public interface SecurityLogConfig {

    /**
     * Retention of each recorded event.
     *
     * @return retention window (default: 90 days)
     */
    @WithDefault("P90D")
    Duration retention();
}
