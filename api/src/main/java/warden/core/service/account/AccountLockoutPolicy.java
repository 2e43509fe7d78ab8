package warden.core.service.account;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.LockoutConfig;
import warden.core.model.user.AccountSecurityState;
import warden.core.model.user.LockoutTransition;

/**
 * Brute-force lockout rules.
 *
 * <p>Pure state transitions over {@link AccountSecurityState}; persisting the
 * result is the caller's job. The read-modify-write of the counter is not
 * atomic: two concurrent failures against the same account can both read
 * {@code n} and both write {@code n + 1}.
 */
@ApplicationScoped
public class AccountLockoutPolicy {

    private final int maxFailedAttempts;
    private final Duration lockDuration;

    @Inject
    public AccountLockoutPolicy(LockoutConfig config) {
        this(config.maxFailedAttempts(), config.lockDuration());
    }

    public AccountLockoutPolicy(int maxFailedAttempts, Duration lockDuration) {
        if (maxFailedAttempts < 1) {
            throw new IllegalArgumentException("maxFailedAttempts must be at least 1");
        }
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockDuration = lockDuration;
    }

    /**
     * Apply a failed password check.
     *
     * <p>Increments the counter; reaching the threshold locks the account for
     * the configured duration starting at {@code now}.
     *
     * @param state current state
     * @param now time of the failure
     * @return new state and whether this failure locked the account
     */
    public LockoutTransition handleFailedLogin(AccountSecurityState state, Instant now) {
        final var attempts = state.failedLoginAttempts() + 1;
        if (attempts >= maxFailedAttempts) {
            return new LockoutTransition(new AccountSecurityState(attempts, now.plus(lockDuration)), true);
        }
        return new LockoutTransition(new AccountSecurityState(attempts, state.lockedUntil()), false);
    }

    /**
     * Apply a successful login: clears the counter and any lock.
     *
     * @param state current state
     * @return cleared state
     */
    public AccountSecurityState handleSuccessfulLogin(AccountSecurityState state) {
        return AccountSecurityState.clear();
    }

    public boolean isLocked(AccountSecurityState state, Instant now) {
        return state.isLocked(now);
    }

    public int maxFailedAttempts() {
        return maxFailedAttempts;
    }
}
