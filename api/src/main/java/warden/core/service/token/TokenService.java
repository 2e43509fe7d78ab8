package warden.core.service.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenConfig;
import warden.core.model.auth.AuthException;
import warden.core.model.token.TokenClaims;
import warden.core.model.token.TokenMetadata;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenType;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.KeyValueStore;
import warden.core.port.out.TokenCodec;
import warden.core.util.StoreJson;
import warden.core.util.TokenDigest;

/**
 * Issues, validates and revokes access and refresh tokens.
 *
 * <p>Every issued token gets a metadata entry under
 * {@code token:metadata:{userId}:{digest}} that lives exactly as long as the
 * token. Bulk revocation lists those entries instead of scanning the whole
 * blacklist or the whole key space.
 *
 * <p>Token lifecycle: issued, then valid until it either expires naturally or
 * is revoked. There is no way back to valid.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final String METADATA_PREFIX = "token:metadata:";

    private final TokenCodec codec;
    private final RevocationRegistry revocationRegistry;
    private final KeyValueStore store;
    private final TokenConfig config;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public TokenService(
            TokenCodec codec,
            RevocationRegistry revocationRegistry,
            KeyValueStore store,
            TokenConfig config,
            AuthMetrics metrics,
            Clock clock) {
        this.codec = codec;
        this.revocationRegistry = revocationRegistry;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Issue an access token.
     *
     * @param userId token subject
     * @param sessionId bound session (may be null)
     * @param extraClaims additional claims such as {@code purpose}
     * @return the signed token
     */
    public Uni<String> issueAccessToken(String userId, String sessionId, Map<String, Object> extraClaims) {
        return issue(new TokenClaims(userId, TokenType.ACCESS, sessionId, extraClaims), config.accessTtl());
    }

    /**
     * Issue a refresh token.
     *
     * @param userId token subject
     * @param sessionId bound session (may be null)
     * @param extraClaims additional claims
     * @return the signed token
     */
    public Uni<String> issueRefreshToken(String userId, String sessionId, Map<String, Object> extraClaims) {
        return issue(new TokenClaims(userId, TokenType.REFRESH, sessionId, extraClaims), config.refreshTtl());
    }

    private Uni<String> issue(TokenClaims claims, Duration ttl) {
        return Uni.createFrom().item(() -> codec.sign(claims, ttl)).flatMap(token -> {
            // Read the claims back so the metadata expiry is the embedded exp, to the second
            final var payload = codec.verify(token);
            final var metadata = new TokenMetadata(
                    payload.subject(), payload.tokenType(), payload.issuedAt(), payload.expiresAt());
            return store.set(
                            metadataKey(payload.subject(), TokenDigest.of(token)),
                            StoreJson.write(metadata),
                            remainingLifetime(payload.expiresAt()).orElse(ttl))
                    .invoke(() -> LOG.debugf(
                            "Issued %s token %s for user %s",
                            claims.tokenType(), TokenDigest.forLog(token), claims.subject()))
                    .replaceWith(token);
        });
    }

    /**
     * Validate a token for the given use.
     *
     * <p>Read-only: never extends or mutates token or session state.
     *
     * @param token the token
     * @param expectedType the type the caller requires
     * @return the verified payload
     */
    public Uni<TokenPayload> validate(String token, TokenType expectedType) {
        return Uni.createFrom().item(() -> codec.verify(token)).flatMap(payload -> {
            if (payload.tokenType() != expectedType) {
                return Uni.createFrom().failure(new AuthException.TokenWrongType(expectedType, payload.tokenType()));
            }
            return revocationRegistry.isRevoked(TokenDigest.of(token)).flatMap(revoked -> {
                if (revoked) {
                    return Uni.createFrom().failure(new AuthException.TokenRevoked());
                }
                return Uni.createFrom().item(payload);
            });
        });
    }

    /**
     * Make sure a token can no longer be used.
     *
     * <p>Expired, malformed or forged tokens are already unusable, so they
     * count as revoked and nothing is written.
     *
     * @param token the token
     * @return true if a blacklist entry was written
     */
    public Uni<Boolean> revoke(String token) {
        final TokenPayload payload;
        try {
            payload = codec.verify(token);
        } catch (AuthException.TokenExpired | AuthException.TokenInvalid e) {
            LOG.debugf("Revoke of unusable token ignored: %s", e.getMessage());
            return Uni.createFrom().item(false);
        }
        return remainingLifetime(payload.expiresAt())
                .map(remaining -> revocationRegistry
                        .revoke(TokenDigest.of(token), remaining)
                        .invoke(written -> {
                            if (written) {
                                metrics.recordTokensRevoked(1);
                            }
                        }))
                .orElseGet(() -> Uni.createFrom().item(false));
    }

    /**
     * Revoke every live token issued to a user.
     *
     * <p>Two phases: list the user's metadata entries, then revoke each token
     * with its own remaining lifetime. Every revoke is attempted even if some
     * fail; failures are then reported together. Re-running is safe.
     *
     * @param userId the user
     * @return number of tokens revoked
     */
    public Uni<Integer> revokeAllForUser(String userId) {
        final var prefix = metadataKey(userId, "");
        return store.scan(prefix + "*").flatMap(keys -> {
            if (keys.isEmpty()) {
                LOG.debugf("No live tokens for user %s", userId);
                return Uni.createFrom().item(0);
            }
            List<Uni<Boolean>> revocations = new ArrayList<>(keys.size());
            for (String key : keys) {
                revocations.add(revokeListed(key, key.substring(prefix.length())));
            }
            return Uni.join().all(revocations).andCollectFailures().map(results -> {
                final var revoked = (int) results.stream().filter(Boolean::booleanValue).count();
                LOG.infof("Revoked %d token(s) for user %s", revoked, userId);
                metrics.recordTokensRevoked(revoked);
                return revoked;
            });
        });
    }

    private Uni<Boolean> revokeListed(String metadataKey, String tokenDigest) {
        // The entry may have expired between the scan and this read
        return store.get(metadataKey).flatMap(json -> json.map(value -> StoreJson.read(value, TokenMetadata.class))
                .flatMap(metadata -> remainingLifetime(metadata.expiresAt()))
                .map(remaining -> revocationRegistry.revoke(tokenDigest, remaining))
                .orElseGet(() -> Uni.createFrom().item(false)));
    }

    /**
     * Lifetime configured for access tokens, in seconds.
     */
    public long accessTokenTtlSeconds() {
        return config.accessTtl().toSeconds();
    }

    /**
     * Lifetime configured for refresh tokens.
     */
    public Duration refreshTokenTtl() {
        return config.refreshTtl();
    }

    private Optional<Duration> remainingLifetime(Instant expiresAt) {
        final var remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isZero() || remaining.isNegative() ? Optional.empty() : Optional.of(remaining);
    }

    static String metadataKey(String userId, String tokenDigest) {
        return METADATA_PREFIX + userId + ":" + tokenDigest;
    }
}
