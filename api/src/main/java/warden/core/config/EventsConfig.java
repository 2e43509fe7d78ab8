package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for outbound event delivery.
 *
 * <p>Configuration prefix: {@code warden.events}
 */
@ConfigMapping(prefix = "warden.events")
public interface EventsConfig {

    /**
     * Maximum number of undelivered events held in memory. Further events are dropped.
     *
     * @return queue capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();

    /**
     * Delivery attempts per handler before an event is given up.
     *
     * @return max attempts (default: 3)
     */
    @WithDefault("3")
    int maxAttempts();

    /**
     * Pause between delivery attempts.
     *
     * @return retry backoff (default: 200 milliseconds)
     */
    @WithDefault("PT0.2S")
    Duration retryBackoff();
}
