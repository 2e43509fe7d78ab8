package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for account lockout.
 *
 * <p>Configuration prefix: {@code warden.lockout}
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Consecutive failed logins that lock the account.
     *
     * @return threshold (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * How long an account stays locked once the threshold is reached.
     *
     * @return lock duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration lockDuration();
}
