package warden.core.port.out;

import java.time.Duration;

import warden.core.model.token.TokenClaims;
import warden.core.model.token.TokenPayload;

/**
 * Port interface for signing and verifying self-contained tokens.
 *
 * <p>Implementations are pure: no I/O and no state beyond the signing key.
 * Expiry is embedded in the token and checked during {@link #verify}.
 */
public interface TokenCodec {

    /**
     * Sign claims into a compact token.
     *
     * @param claims claims to embed
     * @param ttl lifetime from now
     * @return signed token
     */
    String sign(TokenClaims claims, Duration ttl);

    /**
     * Verify signature and expiry of a token.
     *
     * @param token the compact token
     * @return the verified payload
     * @throws warden.core.model.auth.AuthException.TokenInvalid if malformed or the signature does not match
     * @throws warden.core.model.auth.AuthException.TokenExpired if the token is past its expiry
     */
    TokenPayload verify(String token);
}
