package warden.core.model.user;

import java.time.Instant;

/**
 * User aggregate as seen by the authentication core.
 *
 * @param id           user id
 * @param email        normalized (lower-case) email
 * @param passwordHash hashed password
 * @param active       false once the account is deactivated
 * @param verified     true once the email has been confirmed
 * @param security     failed-login counter and lock state
 * @param createdAt    creation time
 * @param updatedAt    last modification time
 * @param lastLoginAt  last successful login, null if never
 */
public record User(
        String id,
        String email,
        String passwordHash,
        boolean active,
        boolean verified,
        AccountSecurityState security,
        Instant createdAt,
        Instant updatedAt,
        Instant lastLoginAt) {

    public User {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("User id cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email cannot be null or blank");
        }
        if (security == null) {
            security = AccountSecurityState.clear();
        }
    }

    /**
     * Creates an active, unverified account.
     */
    public static User create(String id, String email, String passwordHash, Instant now) {
        return new User(id, email, passwordHash, true, false, AccountSecurityState.clear(), now, now, null);
    }

    public boolean isLocked(Instant now) {
        return security.isLocked(now);
    }

    public User withSecurity(AccountSecurityState security, Instant now) {
        return new User(id, email, passwordHash, active, verified, security, createdAt, now, lastLoginAt);
    }

    public User withPasswordHash(String passwordHash, Instant now) {
        return new User(id, email, passwordHash, active, verified, security, createdAt, now, lastLoginAt);
    }

    public User withLastLoginAt(Instant lastLoginAt) {
        return new User(id, email, passwordHash, active, verified, security, createdAt, lastLoginAt, lastLoginAt);
    }

    public User withActive(boolean active, Instant now) {
        return new User(id, email, passwordHash, active, verified, security, createdAt, now, lastLoginAt);
    }
}
