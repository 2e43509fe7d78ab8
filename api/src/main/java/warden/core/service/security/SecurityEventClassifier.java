package warden.core.service.security;

import java.util.Map;

import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

/**
 * Maps security event types to severities.
 *
 * <p>Callers never pick a severity themselves, so the same kind of event
 * always lands in the audit trail with the same level.
 */
public final class SecurityEventClassifier {

    /** Event data flag that escalates any event to {@link Severity#CRITICAL}. */
    public static final String COMPROMISED_FLAG = "compromised";

    private SecurityEventClassifier() {}

    /**
     * Classify an event.
     *
     * @param type event type
     * @param data event data; a {@code compromised=true} entry escalates to CRITICAL
     * @return severity
     */
    public static Severity classify(SecurityEventType type, Map<String, Object> data) {
        if (data != null && Boolean.TRUE.equals(data.get(COMPROMISED_FLAG))) {
            return Severity.CRITICAL;
        }
        return switch (type.category()) {
            case AUTHENTICATION -> type == SecurityEventType.LOGIN_FAILURE ? Severity.WARNING : Severity.INFO;
            case TOKEN -> type == SecurityEventType.TOKEN_REVOKED ? Severity.WARNING : Severity.INFO;
            case ACCOUNT -> type == SecurityEventType.ACCOUNT_LOCKED ? Severity.WARNING : Severity.INFO;
            case PASSWORD -> Severity.WARNING;
            case SESSION -> type == SecurityEventType.ALL_SESSIONS_TERMINATED ? Severity.WARNING : Severity.INFO;
            case ACCESS -> type == SecurityEventType.RATE_LIMIT_EXCEEDED ? Severity.WARNING : Severity.ERROR;
        };
    }
}
