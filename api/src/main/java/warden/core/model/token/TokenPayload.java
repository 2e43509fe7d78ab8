package warden.core.model.token;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Verified contents of a signed token.
 *
 * @param subject     user id ({@code sub})
 * @param tokenType   embedded token type
 * @param issuedAt    issue time ({@code iat})
 * @param expiresAt   expiry ({@code exp})
 * @param tokenId     unique token id ({@code jti})
 * @param sessionId   bound session ({@code sid}), may be null
 * @param extraClaims remaining non-registered claims
 */
public record TokenPayload(
        String subject,
        TokenType tokenType,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId,
        String sessionId,
        Map<String, Object> extraClaims) {

    public static final String PURPOSE_CLAIM = "purpose";

    public TokenPayload {
        extraClaims = extraClaims == null ? Map.of() : Map.copyOf(extraClaims);
    }

    public Optional<String> sessionIdOpt() {
        return Optional.ofNullable(sessionId);
    }

    public Optional<Object> claim(String name) {
        return Optional.ofNullable(extraClaims.get(name));
    }

    /**
     * Returns the {@code purpose} marker, e.g. {@code password-reset}.
     */
    public Optional<String> purpose() {
        return claim(PURPOSE_CLAIM).map(Object::toString);
    }
}
