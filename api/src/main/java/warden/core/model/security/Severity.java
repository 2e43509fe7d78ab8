package warden.core.model.security;

/**
 * Severity levels for audited security events.
 */
public enum Severity {
    /** Routine state changes (login success, token issued). */
    INFO,
    /** Events worth a second look (failed login, lock, password change). */
    WARNING,
    /** Rejected access attempts. */
    ERROR,
    /** Confirmed or suspected credential compromise. */
    CRITICAL
}
