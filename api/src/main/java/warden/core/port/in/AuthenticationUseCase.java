package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.AuthResult;
import warden.core.model.auth.ClientContext;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventQuery;

/**
 * Inbound port for credential-based authentication.
 *
 * <p>Failures are reported as {@link warden.core.model.auth.AuthException}
 * subtypes. Store failures propagate unchanged, except where an operation
 * documents that it always succeeds.
 */
public interface AuthenticationUseCase {

    /**
     * Authenticate with email and password.
     *
     * <p>Rejects a locked account before the password is compared. A wrong
     * password increments the failed-attempt counter and may lock the account.
     *
     * @param email account email (case-insensitive)
     * @param password raw password
     * @param client client network details
     * @return token pair bound to a new session
     * @throws warden.core.model.auth.AuthException.InvalidCredentials unknown email or wrong password
     * @throws warden.core.model.auth.AuthException.AccountLocked account locked, now or by this attempt
     * @throws warden.core.model.auth.AuthException.AccountInactive account deactivated
     */
    Uni<AuthResult> login(String email, String password, ClientContext client);

    /**
     * Create an account and sign it in.
     *
     * @param email account email (case-insensitive)
     * @param password raw password, checked against the password policy
     * @param client client network details
     * @return token pair bound to a new session
     * @throws warden.core.model.auth.AuthException.AlreadyExists email already registered
     * @throws warden.core.model.auth.AuthException.InvalidPassword password policy violated
     */
    Uni<AuthResult> register(String email, String password, ClientContext client);

    /**
     * Exchange a refresh token for a new token pair on the same session.
     *
     * <p>The presented refresh token is revoked and the session re-extended.
     *
     * @param refreshToken current refresh token
     * @return new token pair
     */
    Uni<AuthResult> refresh(String refreshToken);

    /**
     * End a session. Always succeeds; cleanup failures are only logged.
     *
     * @param sessionId session to end (may be null)
     * @param token access or refresh token to revoke (may be null)
     * @return Uni completing when cleanup has been attempted
     */
    Uni<Void> logout(String sessionId, String token);

    /**
     * Start a password reset. Always succeeds, whether or not the email is known.
     *
     * @param email account email
     * @return Uni completing when the request has been handled
     */
    Uni<Void> forgotPassword(String email);

    /**
     * Complete a password reset. Revokes every token and session of the user.
     *
     * @param resetToken token issued by {@link #forgotPassword}
     * @param newPassword raw new password
     * @return Uni completing when the password has been changed
     * @throws warden.core.model.auth.AuthException.TokenInvalid not a password reset token
     * @throws warden.core.model.auth.AuthException.InvalidPassword password policy violated
     */
    Uni<Void> resetPassword(String resetToken, String newPassword);

    /**
     * Read a user's security log, most recent first.
     *
     * @param userId the user
     * @param query filters and page selection
     * @return matching events
     */
    Uni<List<SecurityEvent>> securityEvents(String userId, SecurityEventQuery query);
}
