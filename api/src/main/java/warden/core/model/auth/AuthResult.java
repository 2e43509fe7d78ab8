package warden.core.model.auth;

/**
 * Outcome of a successful login, registration or refresh.
 *
 * @param accessToken  short-lived access token
 * @param refreshToken long-lived refresh token
 * @param userId       authenticated user id
 * @param email        authenticated user's email
 * @param sessionId    session the tokens are bound to
 * @param expiresIn    access token lifetime in seconds
 */
public record AuthResult(
        String accessToken, String refreshToken, String userId, String email, String sessionId, long expiresIn) {}
