package warden.core.model.security;

/**
 * Kinds of audited security events.
 */
public enum SecurityEventType {
    LOGIN_ATTEMPT(SecurityEventCategory.AUTHENTICATION),
    LOGIN_SUCCESS(SecurityEventCategory.AUTHENTICATION),
    LOGIN_FAILURE(SecurityEventCategory.AUTHENTICATION),
    LOGOUT(SecurityEventCategory.AUTHENTICATION),

    TOKEN_CREATED(SecurityEventCategory.TOKEN),
    TOKEN_REFRESHED(SecurityEventCategory.TOKEN),
    TOKEN_REVOKED(SecurityEventCategory.TOKEN),
    TOKEN_EXPIRED(SecurityEventCategory.TOKEN),

    ACCOUNT_CREATED(SecurityEventCategory.ACCOUNT),
    ACCOUNT_UPDATED(SecurityEventCategory.ACCOUNT),
    ACCOUNT_LOCKED(SecurityEventCategory.ACCOUNT),
    ACCOUNT_UNLOCKED(SecurityEventCategory.ACCOUNT),

    PASSWORD_CHANGED(SecurityEventCategory.PASSWORD),
    PASSWORD_RESET_REQUESTED(SecurityEventCategory.PASSWORD),
    PASSWORD_RESET_COMPLETED(SecurityEventCategory.PASSWORD),

    SESSION_CREATED(SecurityEventCategory.SESSION),
    SESSION_TERMINATED(SecurityEventCategory.SESSION),
    SESSION_EXPIRED(SecurityEventCategory.SESSION),
    ALL_SESSIONS_TERMINATED(SecurityEventCategory.SESSION),

    UNAUTHORIZED_ACCESS(SecurityEventCategory.ACCESS),
    PERMISSION_VIOLATION(SecurityEventCategory.ACCESS),
    RATE_LIMIT_EXCEEDED(SecurityEventCategory.ACCESS);

    private final SecurityEventCategory category;

    SecurityEventType(SecurityEventCategory category) {
        this.category = category;
    }

    public SecurityEventCategory category() {
        return category;
    }
}
