package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.AuthMetrics;

/**
 * Applies a deadline to Redis commands and records timeouts and failures.
 *
 * <p>Every command is fail-fast: a timeout surfaces as
 * {@link RedisTimeoutException} and any other failure propagates unchanged.
 * There is no fail-open mode. A revocation lookup that cannot be answered
 * must not be read as "not revoked", and a write that timed out has an
 * unknown outcome.
 *
 * <h2>Metrics</h2>
 * Records timeouts and non-timeout failures separately through
 * {@link AuthMetrics#recordStoreTimeout} and {@link AuthMetrics#recordStoreFailure}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final AuthMetrics metrics;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the deadline for each Redis command
     * @param metrics metrics sink (may be null)
     * @param storeName store name used in log messages
     */
    public RedisTimeoutHelper(Duration timeout, AuthMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Apply the deadline to a command.
     *
     * @param operation the Redis command
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    if (metrics != null) {
                        metrics.recordStoreTimeout(operationName);
                    }
                    return new RedisTimeoutException(operationName, storeName);
                })
                .onFailure(failure -> !(failure instanceof RedisTimeoutException))
                .invoke(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    if (metrics != null) {
                        metrics.recordStoreFailure(operationName);
                    }
                });
    }

    /**
     * Exception indicating a Redis command did not complete within the deadline.
     *
     * <p>The command may or may not have been applied.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String store;

        public RedisTimeoutException(String operation, String store) {
            super("Redis operation timeout: " + operation + " in " + store);
            this.operation = operation;
            this.store = store;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the store where the timeout occurred. */
        public String getStore() {
            return store;
        }
    }
}
