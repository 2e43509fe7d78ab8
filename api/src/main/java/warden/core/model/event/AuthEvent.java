package warden.core.model.event;

import java.time.Instant;

/**
 * Outbound notifications about authentication state changes.
 *
 * <p>Events are pushed onto the outbound channel by the core and delivered
 * to {@link warden.spi.AuthEventHandler} implementations by a background worker.
 */
public sealed interface AuthEvent {

    /**
     * Return the user the event concerns.
     *
     * @return user id
     */
    String userId();

    /**
     * Return when the event occurred.
     *
     * @return event time
     */
    Instant occurredAt();

    /**
     * Return a stable name for routing and logging.
     *
     * @return event name, e.g. {@code user.logged-in}
     */
    String eventName();

    record UserRegistered(String userId, String email, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "user.registered";
        }
    }

    record UserLoggedIn(String userId, String sessionId, String ipAddress, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "user.logged-in";
        }
    }

    record UserLoggedOut(String userId, String sessionId, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "user.logged-out";
        }
    }

    record TokenRefreshed(String userId, String sessionId, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "token.refreshed";
        }
    }

    /**
     * Password reset was requested; carries the reset token for delivery by mail.
     */
    record PasswordResetRequested(String userId, String email, String resetToken, Instant occurredAt)
            implements AuthEvent {
        @Override
        public String eventName() {
            return "password.reset-requested";
        }

        @Override
        public String toString() {
            return "PasswordResetRequested[userId=" + userId + ", occurredAt=" + occurredAt + "]";
        }
    }

    record PasswordReset(String userId, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "password.reset";
        }
    }

    record SessionTerminated(String userId, String sessionId, Instant occurredAt) implements AuthEvent {
        @Override
        public String eventName() {
            return "session.terminated";
        }
    }

    /**
     * Sessions of a user were terminated in bulk.
     *
     * @param keptSessionId session left alive, or null when every session ended
     * @param count number of sessions terminated
     */
    record AllSessionsTerminated(String userId, String keptSessionId, int count, Instant occurredAt)
            implements AuthEvent {
        @Override
        public String eventName() {
            return "session.all-terminated";
        }
    }
}
