package warden.core.model.user;

import java.time.Instant;

/**
 * Brute-force protection state carried on the user aggregate.
 *
 * @param failedLoginAttempts consecutive failed logins since the last success
 * @param lockedUntil         end of the current lock, or null when never locked
 */
public record AccountSecurityState(int failedLoginAttempts, Instant lockedUntil) {

    private static final AccountSecurityState CLEAR = new AccountSecurityState(0, null);

    public AccountSecurityState {
        if (failedLoginAttempts < 0) {
            throw new IllegalArgumentException("failedLoginAttempts cannot be negative");
        }
    }

    public static AccountSecurityState clear() {
        return CLEAR;
    }

    /**
     * An account is locked while {@code lockedUntil} lies in the future.
     *
     * @param now evaluation time
     * @return true if logins must be rejected
     */
    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}
