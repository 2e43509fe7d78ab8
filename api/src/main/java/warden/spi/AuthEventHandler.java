package warden.spi;

import warden.core.model.event.AuthEvent;

/**
 * SPI for delivering outbound authentication events.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * invoked from a background worker, never on the request path. A handler that
 * throws is retried with backoff; see {@code warden.events.max-attempts}.
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.AuthEventHandler}
 */
public interface AuthEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "logging", "mailer")
     */
    String name();

    /**
     * Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     *
     * @return true if the handler's external dependencies are configured
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Deliver one event. Throwing signals a failed attempt.
     *
     * @param event the event
     * @throws Exception if delivery failed and may be retried
     */
    void handle(AuthEvent event) throws Exception;

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
