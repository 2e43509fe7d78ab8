package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.SessionSummary;

/**
 * Inbound port for a user managing their own sessions.
 */
public interface SessionManagement {

    /**
     * List a user's live sessions, most recently used first.
     *
     * @param userId the user
     * @param currentSessionId the caller's own session, flagged in the result (may be null)
     * @return session summaries
     */
    Uni<List<SessionSummary>> listSessions(String userId, String currentSessionId);

    /**
     * Terminate one of the user's other sessions.
     *
     * @param userId the user
     * @param sessionId session to terminate
     * @param currentSessionId the caller's own session
     * @return Uni completing when the session is gone
     * @throws warden.core.model.auth.AuthException.SessionTerminationForbidden if {@code sessionId}
     *         is the current session or belongs to another user
     * @throws warden.core.model.auth.AuthException.SessionNotFound if the session does not exist
     */
    Uni<Void> terminateSession(String userId, String sessionId, String currentSessionId);

    /**
     * Terminate every session of the user except the current one.
     *
     * @param userId the user
     * @param currentSessionId session to keep
     * @return number of sessions terminated
     */
    Uni<Integer> terminateOtherSessions(String userId, String currentSessionId);

    /**
     * Log a user out everywhere: revoke all tokens and delete all sessions.
     *
     * @param userId the user
     * @return number of sessions terminated
     */
    Uni<Integer> terminateAllSessions(String userId);

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }
    }
}
