package warden.core.service.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthException;
import warden.core.model.event.AuthEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.session.SessionSummary;
import warden.core.port.in.SessionManagement;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.EventPublisher;
import warden.core.service.security.SecurityEventRecorder;
import warden.core.service.token.TokenService;

/**
 * Implementation of session management operations.
 *
 * <p>Terminating a session deletes its record; the tokens bound to it stop
 * working on refresh because refresh requires the session to exist. Logging
 * out everywhere also revokes every token of the user, so access tokens stop
 * working immediately too.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionStore sessionStore;
    private final TokenService tokenService;
    private final SecurityEventRecorder securityEvents;
    private final EventPublisher eventPublisher;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public SessionService(
            SessionStore sessionStore,
            TokenService tokenService,
            SecurityEventRecorder securityEvents,
            EventPublisher eventPublisher,
            AuthMetrics metrics,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.tokenService = tokenService;
        this.securityEvents = securityEvents;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<List<SessionSummary>> listSessions(String userId, String currentSessionId) {
        return sessionStore.findRecordsByUser(userId).map(records -> records.stream()
                .map(record -> SessionSummary.of(record, currentSessionId))
                .sorted(Comparator.comparing(SessionSummary::lastAccessedAt).reversed())
                .toList());
    }

    @Override
    public Uni<Void> terminateSession(String userId, String sessionId, String currentSessionId) {
        if (sessionId.equals(currentSessionId)) {
            return Uni.createFrom()
                    .failure(new AuthException.SessionTerminationForbidden(
                            "Cannot terminate the current session; log out instead"));
        }
        return sessionStore
                .get(sessionId)
                .flatMap(record -> {
                    if (!record.userId().equals(userId)) {
                        LOG.warnf("User %s attempted to terminate a session of another user", userId);
                        return Uni.createFrom()
                                .failure(new AuthException.SessionTerminationForbidden(
                                        "Session belongs to another user"));
                    }
                    return sessionStore.delete(sessionId);
                })
                .call(deleted -> securityEvents.record(
                        SecurityEventType.SESSION_TERMINATED, userId, Map.of("sessionId", sessionId)))
                .invoke(deleted -> {
                    metrics.recordSessionsTerminated(1);
                    eventPublisher.publish(new AuthEvent.SessionTerminated(userId, sessionId, clock.instant()));
                    LOG.infof("Session %s terminated by user %s", sessionId, userId);
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Integer> terminateOtherSessions(String userId, String currentSessionId) {
        return sessionStore.findByUser(userId).flatMap(ids -> {
            List<Uni<Boolean>> deletions = new ArrayList<>();
            for (String id : ids) {
                if (!id.equals(currentSessionId)) {
                    deletions.add(sessionStore.delete(id));
                }
            }
            if (deletions.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            return Uni.join()
                    .all(deletions)
                    .andCollectFailures()
                    .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                    .call(count -> onBulkTermination(userId, currentSessionId, count));
        });
    }

    @Override
    public Uni<Integer> terminateAllSessions(String userId) {
        return tokenService
                .revokeAllForUser(userId)
                .flatMap(revoked -> sessionStore.deleteAllForUser(userId))
                .call(count -> onBulkTermination(userId, null, count));
    }

    private Uni<Void> onBulkTermination(String userId, String keptSessionId, int count) {
        metrics.recordSessionsTerminated(count);
        eventPublisher.publish(new AuthEvent.AllSessionsTerminated(userId, keptSessionId, count, clock.instant()));
        LOG.infof("Terminated %d session(s) for user %s", count, userId);
        Map<String, Object> data = keptSessionId == null
                ? Map.of("count", count)
                : Map.of("count", count, "keptSessionId", keptSessionId);
        return securityEvents.record(SecurityEventType.ALL_SESSIONS_TERMINATED, userId, data);
    }
}
