package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for password hashing and policy.
 *
 * <p>Configuration prefix: {@code warden.password}
 */
@ConfigMapping(prefix = "warden.password")
public interface PasswordConfig {

    /**
     * bcrypt cost factor (log2 rounds).
     *
     * @return cost (default: 12)
     */
    @WithDefault("12")
    int bcryptCost();

    /**
     * @return minimum password length (default: 8)
     */
    @WithDefault("8")
    int minLength();
}
