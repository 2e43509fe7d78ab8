package warden.core.model.security;

/**
 * Grouping of security event types used for severity classification.
 */
public enum SecurityEventCategory {
    AUTHENTICATION,
    TOKEN,
    ACCOUNT,
    PASSWORD,
    SESSION,
    ACCESS
}
