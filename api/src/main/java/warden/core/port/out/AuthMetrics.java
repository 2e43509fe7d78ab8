package warden.core.port.out;

/**
 * Port interface for recording authentication metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthMetrics {

    /**
     * Record a login attempt outcome.
     *
     * @param outcome outcome tag, e.g. {@code success}, {@code invalid_credentials}
     */
    void recordLogin(String outcome);

    /** Record an account reaching the lockout threshold. */
    void recordLockout();

    /**
     * Record revoked tokens.
     *
     * @param count number of tokens revoked
     */
    void recordTokensRevoked(int count);

    /**
     * Record terminated sessions.
     *
     * @param count number of sessions terminated
     */
    void recordSessionsTerminated(int count);

    /** Record an outbound event dropped because the queue was full or delivery gave up. */
    void recordEventDropped(String eventName);

    /**
     * Record a store operation that exceeded its timeout.
     *
     * @param operation operation name
     */
    void recordStoreTimeout(String operation);

    /**
     * Record a store operation that failed for a reason other than timeout.
     *
     * @param operation operation name
     */
    void recordStoreFailure(String operation);
}
