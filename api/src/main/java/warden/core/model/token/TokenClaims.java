package warden.core.model.token;

import java.util.Map;

/**
 * Claims supplied when minting a token.
 *
 * <p>Issue time, expiry and token id are assigned by the codec.
 *
 * @param subject     user id
 * @param tokenType   access or refresh
 * @param sessionId   session the token is bound to (may be null)
 * @param extraClaims additional claims such as {@code purpose}
 */
public record TokenClaims(String subject, TokenType tokenType, String sessionId, Map<String, Object> extraClaims) {

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (tokenType == null) {
            throw new IllegalArgumentException("Token type cannot be null");
        }
        extraClaims = extraClaims == null ? Map.of() : Map.copyOf(extraClaims);
    }
}
