package warden.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthResult;
import warden.core.model.auth.ClientContext;
import warden.core.model.event.AuthEvent;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventQuery;
import warden.core.model.security.SecurityEventType;
import warden.core.model.session.SessionRecord;
import warden.core.model.session.SessionUpdate;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenType;
import warden.core.model.user.LockoutTransition;
import warden.core.model.user.User;
import warden.core.port.in.AuthenticationUseCase;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.EventPublisher;
import warden.core.port.out.PasswordHasher;
import warden.core.port.out.UserRepository;
import warden.core.service.account.AccountLockoutPolicy;
import warden.core.service.account.PasswordPolicy;
import warden.core.service.security.SecurityEventRecorder;
import warden.core.service.session.SessionStore;
import warden.core.service.token.TokenService;
import warden.core.service.user.UserInfoCache;
import warden.core.util.TokenDigest;

/**
 * Credential authentication: login, registration, refresh, logout and password reset.
 *
 * <p>Each request runs its store calls sequentially. Security events and
 * outbound events are side effects that never fail the operation.
 */
@ApplicationScoped
public class AuthenticationService implements AuthenticationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    static final String PASSWORD_RESET_PURPOSE = "password-reset";
    static final String EMAIL_CLAIM = "email";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final AccountLockoutPolicy lockoutPolicy;
    private final TokenService tokenService;
    private final SessionStore sessionStore;
    private final SecurityEventRecorder securityEvents;
    private final UserInfoCache userInfoCache;
    private final EventPublisher eventPublisher;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public AuthenticationService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            AccountLockoutPolicy lockoutPolicy,
            TokenService tokenService,
            SessionStore sessionStore,
            SecurityEventRecorder securityEvents,
            UserInfoCache userInfoCache,
            EventPublisher eventPublisher,
            AuthMetrics metrics,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.lockoutPolicy = lockoutPolicy;
        this.tokenService = tokenService;
        this.sessionStore = sessionStore;
        this.securityEvents = securityEvents;
        this.userInfoCache = userInfoCache;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<AuthResult> login(String email, String password, ClientContext client) {
        final var normalized = normalize(email);
        return userRepository.findByEmail(normalized).flatMap(found -> {
            if (found.isEmpty()) {
                return rejectUnknownEmail(client);
            }
            final var user = found.get();
            final var now = clock.instant();

            // Locked accounts are rejected before any password comparison
            if (lockoutPolicy.isLocked(user.security(), now)) {
                metrics.recordLogin("locked");
                return securityEvents
                        .record(SecurityEventType.LOGIN_FAILURE, user.id(), clientData(client, "account_locked"))
                        .flatMap(ignored -> Uni.createFrom()
                                .failure(new AuthException.AccountLocked(
                                        user.security().lockedUntil())));
            }

            return Uni.createFrom()
                    .item(() -> passwordHasher.compare(password, user.passwordHash()))
                    .flatMap(matches -> {
                        if (!matches) {
                            return handleWrongPassword(user, client, now);
                        }
                        if (!user.active()) {
                            metrics.recordLogin("inactive");
                            return securityEvents
                                    .record(
                                            SecurityEventType.LOGIN_FAILURE,
                                            user.id(),
                                            clientData(client, "account_inactive"))
                                    .flatMap(ignored ->
                                            Uni.createFrom().failure(new AuthException.AccountInactive()));
                        }
                        return handleSuccessfulLogin(user, client, now);
                    });
        });
    }

    private Uni<AuthResult> rejectUnknownEmail(ClientContext client) {
        LOG.debug("Login attempt for unknown email");
        metrics.recordLogin("invalid_credentials");
        return securityEvents
                .record(SecurityEventType.LOGIN_FAILURE, null, clientData(client, "unknown_email"))
                .flatMap(ignored -> Uni.createFrom().failure(new AuthException.InvalidCredentials()));
    }

    private Uni<AuthResult> handleWrongPassword(User user, ClientContext client, Instant now) {
        final LockoutTransition transition = lockoutPolicy.handleFailedLogin(user.security(), now);
        final var updated = user.withSecurity(transition.state(), now);

        // The counter must be persisted before the caller sees the failure
        return userRepository
                .save(updated)
                .call(saved -> userInfoCache.invalidate(saved.id()))
                .flatMap(saved -> {
                    if (transition.becameLocked()) {
                        LOG.warnf(
                                "Account %s locked after %d failed login attempts",
                                saved.id(), transition.state().failedLoginAttempts());
                        metrics.recordLogin("locked");
                        metrics.recordLockout();
                        final Map<String, Object> data = clientData(client, "too_many_attempts");
                        data.put("lockedUntil", transition.state().lockedUntil().toString());
                        return securityEvents
                                .record(SecurityEventType.ACCOUNT_LOCKED, saved.id(), data)
                                .flatMap(ignored -> Uni.createFrom()
                                        .failure(new AuthException.AccountLocked(
                                                transition.state().lockedUntil())));
                    }
                    metrics.recordLogin("invalid_credentials");
                    final Map<String, Object> data = clientData(client, "wrong_password");
                    data.put("failedAttempts", transition.state().failedLoginAttempts());
                    return securityEvents
                            .record(SecurityEventType.LOGIN_FAILURE, saved.id(), data)
                            .flatMap(ignored -> Uni.createFrom().failure(new AuthException.InvalidCredentials()));
                });
    }

    private Uni<AuthResult> handleSuccessfulLogin(User user, ClientContext client, Instant now) {
        final var updated = user.withSecurity(lockoutPolicy.handleSuccessfulLogin(user.security()), now)
                .withLastLoginAt(now);
        return userRepository
                .save(updated)
                .call(saved -> userInfoCache.invalidate(saved.id()))
                .flatMap(saved -> startSession(saved, client))
                .call(result -> securityEvents.record(
                        SecurityEventType.LOGIN_SUCCESS, result.userId(), sessionData(result.sessionId(), client)))
                .invoke(result -> {
                    metrics.recordLogin("success");
                    eventPublisher.publish(new AuthEvent.UserLoggedIn(
                            result.userId(), result.sessionId(), client.ipAddress(), clock.instant()));
                    LOG.infof("User %s logged in, session %s", result.userId(), result.sessionId());
                });
    }

    @Override
    public Uni<AuthResult> register(String email, String password, ClientContext client) {
        final var normalized = normalize(email);
        return userRepository.findByEmail(normalized).flatMap(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom().failure(new AuthException.AlreadyExists());
            }
            passwordPolicy.validate(password);
            return Uni.createFrom()
                    .item(() -> passwordHasher.hash(password))
                    .map(hash -> User.create(UUID.randomUUID().toString(), normalized, hash, clock.instant()))
                    .flatMap(userRepository::save)
                    .call(user -> securityEvents.record(
                            SecurityEventType.ACCOUNT_CREATED, user.id(), clientData(client, null)))
                    .invoke(user -> eventPublisher.publish(
                            new AuthEvent.UserRegistered(user.id(), user.email(), clock.instant())))
                    .flatMap(user -> startSession(user, client))
                    .invoke(result -> LOG.infof("Registered user %s", result.userId()));
        });
    }

    /**
     * Create a session and mint the token pair bound to it.
     */
    private Uni<AuthResult> startSession(User user, ClientContext client) {
        return sessionStore
                .create(user.id(), Map.of(), client.ipAddress(), client.userAgent())
                .call(sessionId -> securityEvents.record(
                        SecurityEventType.SESSION_CREATED, user.id(), sessionData(sessionId, client)))
                .flatMap(sessionId -> issuePair(user.id(), user.email(), sessionId));
    }

    private Uni<AuthResult> issuePair(String userId, String email, String sessionId) {
        return tokenService
                .issueAccessToken(userId, sessionId, Map.of(EMAIL_CLAIM, email))
                .flatMap(accessToken -> tokenService
                        .issueRefreshToken(userId, sessionId, Map.of())
                        .map(refreshToken -> new AuthResult(
                                accessToken,
                                refreshToken,
                                userId,
                                email,
                                sessionId,
                                tokenService.accessTokenTtlSeconds())));
    }

    @Override
    public Uni<AuthResult> refresh(String refreshToken) {
        return tokenService.validate(refreshToken, TokenType.REFRESH).flatMap(payload -> {
            final var sessionId = payload.sessionIdOpt()
                    .orElseThrow(() -> new AuthException.TokenInvalid("Refresh token is not bound to a session"));
            return sessionStore
                    .get(sessionId)
                    .flatMap(session -> refreshSession(refreshToken, payload, session));
        });
    }

    private Uni<AuthResult> refreshSession(String refreshToken, TokenPayload payload, SessionRecord session) {
        if (!session.userId().equals(payload.subject())) {
            LOG.warnf("Refresh token subject does not own session %s", session.sessionId());
            return Uni.createFrom().failure(new AuthException.TokenInvalid("Session belongs to another user"));
        }
        return userInfoCache.getOrLoad(payload.subject()).flatMap(info -> {
            if (info.isEmpty()) {
                return Uni.createFrom().failure(new AuthException.TokenInvalid("Unknown subject"));
            }
            if (!info.get().active()) {
                return Uni.createFrom().failure(new AuthException.AccountInactive());
            }
            final var user = info.get();
            // Whole seconds, so the session never outlives the refresh token minted below
            final var touchedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            return tokenService
                    .revoke(refreshToken)
                    .flatMap(ignored -> issuePair(user.userId(), user.email(), session.sessionId()))
                    .call(result -> sessionStore.update(session.sessionId(), SessionUpdate.touch(touchedAt)))
                    .call(result -> securityEvents.record(
                            SecurityEventType.TOKEN_REFRESHED,
                            result.userId(),
                            Map.of("sessionId", result.sessionId())))
                    .invoke(result -> eventPublisher.publish(
                            new AuthEvent.TokenRefreshed(result.userId(), result.sessionId(), clock.instant())));
        });
    }

    @Override
    public Uni<Void> logout(String sessionId, String token) {
        final Uni<Boolean> revoke = token == null
                ? Uni.createFrom().item(false)
                : tokenService.revoke(token).onFailure().recoverWithItem(error -> {
                    LOG.warnf(
                            "Token revocation failed during logout for %s: %s",
                            TokenDigest.forLog(token), error.getMessage());
                    return false;
                });

        return revoke.flatMap(ignored -> sessionId == null ? Uni.createFrom().voidItem() : endSession(sessionId));
    }

    private Uni<Void> endSession(String sessionId) {
        return sessionStore
                .find(sessionId)
                .call(record -> sessionStore.delete(sessionId))
                .call(record -> record.map(session -> securityEvents
                                .record(SecurityEventType.LOGOUT, session.userId(), Map.of("sessionId", sessionId))
                                .invoke(() -> eventPublisher.publish(
                                        new AuthEvent.UserLoggedOut(session.userId(), sessionId, clock.instant()))))
                        .orElseGet(() -> Uni.createFrom().voidItem()))
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Session cleanup failed during logout of %s: %s", sessionId, error.getMessage());
                    return null;
                });
    }

    @Override
    public Uni<Void> forgotPassword(String email) {
        final var normalized = normalize(email);
        return userRepository
                .findByEmail(normalized)
                .flatMap(found -> {
                    if (found.isEmpty() || !found.get().active()) {
                        LOG.debug("Password reset requested for unknown or inactive account");
                        return Uni.createFrom().voidItem();
                    }
                    final var user = found.get();
                    return tokenService
                            .issueAccessToken(user.id(), null, Map.of(TokenPayload.PURPOSE_CLAIM, PASSWORD_RESET_PURPOSE))
                            .call(token -> securityEvents.record(
                                    SecurityEventType.PASSWORD_RESET_REQUESTED, user.id(), Map.of()))
                            .invoke(token -> eventPublisher.publish(new AuthEvent.PasswordResetRequested(
                                    user.id(), user.email(), token, clock.instant())))
                            .replaceWithVoid();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.error("Password reset request could not be processed", error);
                    return null;
                });
    }

    @Override
    public Uni<Void> resetPassword(String resetToken, String newPassword) {
        return tokenService.validate(resetToken, TokenType.ACCESS).flatMap(payload -> {
            if (!payload.purpose().filter(PASSWORD_RESET_PURPOSE::equals).isPresent()) {
                return Uni.createFrom().failure(new AuthException.TokenInvalid("Not a password reset token"));
            }
            passwordPolicy.validate(newPassword);
            final var userId = payload.subject();
            return userRepository
                    .findById(userId)
                    .flatMap(found -> found.map(user -> Uni.createFrom().item(user))
                            .orElseGet(() -> Uni.createFrom()
                                    .failure(new AuthException.TokenInvalid("Unknown subject"))))
                    .flatMap(user -> {
                        final var hash = passwordHasher.hash(newPassword);
                        return userRepository.save(user.withPasswordHash(hash, clock.instant()));
                    })
                    .call(saved -> tokenService.revoke(resetToken))
                    .call(saved -> tokenService.revokeAllForUser(userId))
                    .call(saved -> sessionStore.deleteAllForUser(userId))
                    .call(saved -> userInfoCache.invalidate(userId))
                    .call(saved -> securityEvents.record(SecurityEventType.PASSWORD_RESET_COMPLETED, userId, Map.of()))
                    .invoke(saved -> {
                        eventPublisher.publish(new AuthEvent.PasswordReset(userId, clock.instant()));
                        LOG.infof("Password reset completed for user %s; all tokens and sessions revoked", userId);
                    })
                    .replaceWithVoid();
        });
    }

    @Override
    public Uni<List<SecurityEvent>> securityEvents(String userId, SecurityEventQuery query) {
        return securityEvents.query(userId, query);
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Object> clientData(ClientContext client, String reason) {
        final Map<String, Object> data = new HashMap<>();
        if (client.ipAddress() != null) {
            data.put("ip", client.ipAddress());
        }
        if (client.userAgent() != null) {
            data.put("userAgent", client.userAgent());
        }
        if (reason != null) {
            data.put("reason", reason);
        }
        return data;
    }

    private static Map<String, Object> sessionData(String sessionId, ClientContext client) {
        final var data = clientData(client, null);
        data.put("sessionId", sessionId);
        return data;
    }
}
