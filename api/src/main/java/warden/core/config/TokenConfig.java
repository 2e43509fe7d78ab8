package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for token issuance.
 *
 * <p>Configuration prefix: {@code warden.token}
 */
@ConfigMapping(prefix = "warden.token")
public interface TokenConfig {

    /**
     * HMAC signing secret. Must be at least 32 bytes.
     *
     * @return signing secret
     */
    String secret();

    /**
     * Value of the {@code iss} claim.
     *
     * @return issuer (default: warden)
     */
    @WithDefault("warden")
    String issuer();

    /**
     * Lifetime of access tokens.
     *
     * @return access token TTL (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration accessTtl();

    /**
     * Lifetime of refresh tokens. Sessions share this lifetime.
     *
     * @return refresh token TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration refreshTtl();
}
