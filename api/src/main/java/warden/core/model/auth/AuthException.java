package warden.core.model.auth;

import java.time.Instant;

import warden.core.model.token.TokenType;

/**
 * Base type for authentication failures surfaced to callers.
 *
 * <p>Each subtype carries a stable {@link #code()} that the request-handling
 * boundary maps to a user-facing status. Infrastructure failures are never
 * expressed with these types.
 */
public abstract sealed class AuthException extends RuntimeException {

    private final String code;

    protected AuthException(String code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Returns the stable error code for this failure.
     *
     * @return error code, e.g. {@code invalid_credentials}
     */
    public String code() {
        return code;
    }

    /** Unknown email or wrong password. */
    public static final class InvalidCredentials extends AuthException {
        public InvalidCredentials() {
            super("invalid_credentials", "Invalid email or password");
        }
    }

    /** Account is temporarily locked after repeated failures. */
    public static final class AccountLocked extends AuthException {
        private final Instant lockedUntil;

        public AccountLocked(Instant lockedUntil) {
            super("account_locked", "Account is locked until " + lockedUntil);
            this.lockedUntil = lockedUntil;
        }

        public Instant lockedUntil() {
            return lockedUntil;
        }
    }

    /** Account exists but has been deactivated. */
    public static final class AccountInactive extends AuthException {
        public AccountInactive() {
            super("account_inactive", "Account is inactive");
        }
    }

    /** Token is malformed, has a bad signature, or carries unexpected claims. */
    public static final class TokenInvalid extends AuthException {
        public TokenInvalid(String reason) {
            super("token_invalid", "Invalid token: " + reason);
        }
    }

    public static final class TokenExpired extends AuthException {
        public TokenExpired() {
            super("token_expired", "Token has expired");
        }
    }

    public static final class TokenRevoked extends AuthException {
        public TokenRevoked() {
            super("token_revoked", "Token has been revoked");
        }
    }

    /** Token is valid but of the wrong kind for the operation. */
    public static final class TokenWrongType extends AuthException {
        private final TokenType expected;
        private final TokenType actual;

        public TokenWrongType(TokenType expected, TokenType actual) {
            super("token_wrong_type", "Expected " + expected + " token but got " + actual);
            this.expected = expected;
            this.actual = actual;
        }

        public TokenType expected() {
            return expected;
        }

        public TokenType actual() {
            return actual;
        }
    }

    public static final class SessionNotFound extends AuthException {
        private final String sessionId;

        public SessionNotFound(String sessionId) {
            super("session_not_found", "Session not found");
            this.sessionId = sessionId;
        }

        public String sessionId() {
            return sessionId;
        }
    }

    /** Registration collided with an existing account. */
    public static final class AlreadyExists extends AuthException {
        public AlreadyExists() {
            super("already_exists", "An account with this email already exists");
        }
    }

    /** New password does not satisfy the password policy. */
    public static final class InvalidPassword extends AuthException {
        public InvalidPassword(String reason) {
            super("invalid_password", reason);
        }
    }

    /** Session exists but the caller may not terminate it. */
    public static final class SessionTerminationForbidden extends AuthException {
        public SessionTerminationForbidden(String reason) {
            super("session_termination_forbidden", reason);
        }
    }
}
