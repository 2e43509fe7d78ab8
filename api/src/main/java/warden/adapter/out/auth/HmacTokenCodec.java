package warden.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import warden.core.config.TokenConfig;
import warden.core.model.auth.AuthException;
import warden.core.model.token.TokenClaims;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenType;
import warden.core.port.out.TokenCodec;

/**
 * HS256 (HMAC with SHA-256) token codec.
 *
 * <p>Tokens are compact JWS with the registered claims {@code iss}, {@code sub},
 * {@code iat}, {@code exp} and {@code jti}, plus {@code type} and, for
 * session-bound tokens, {@code sid}. Expiry is evaluated against the injected
 * {@link Clock} with no skew allowance.
 */
@ApplicationScoped
public class HmacTokenCodec implements TokenCodec {

    private static final Logger LOG = Logger.getLogger(HmacTokenCodec.class);

    static final String TYPE_CLAIM = "type";
    static final String SESSION_CLAIM = "sid";
    private static final int MIN_SECRET_BYTES = 32;
    private static final Set<String> RESERVED_CLAIMS =
            Set.of("iss", "sub", "aud", "iat", "nbf", "exp", "jti", TYPE_CLAIM, SESSION_CLAIM);

    private final HmacKey key;
    private final String issuer;
    private final Clock clock;

    @Inject
    public HmacTokenCodec(TokenConfig config, Clock clock) {
        this(config.secret(), config.issuer(), clock);
    }

    public HmacTokenCodec(String secret, String issuer, Clock clock) {
        final var secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "Token secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = new HmacKey(secretBytes);
        this.issuer = issuer;
        this.clock = clock;
    }

    @Override
    public String sign(TokenClaims tokenClaims, Duration ttl) {
        final var issuedAt = clock.instant().getEpochSecond();

        final var claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setSubject(tokenClaims.subject());
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt));
        claims.setExpirationTime(NumericDate.fromSeconds(issuedAt + ttl.toSeconds()));
        claims.setGeneratedJwtId();
        claims.setStringClaim(TYPE_CLAIM, tokenClaims.tokenType().claimValue());
        if (tokenClaims.sessionId() != null) {
            claims.setStringClaim(SESSION_CLAIM, tokenClaims.sessionId());
        }
        for (var extra : tokenClaims.extraClaims().entrySet()) {
            if (RESERVED_CLAIMS.contains(extra.getKey())) {
                throw new IllegalArgumentException("Extra claim overrides a reserved claim: " + extra.getKey());
            }
            claims.setClaim(extra.getKey(), extra.getValue());
        }

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new TokenSigningException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public TokenPayload verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException.TokenInvalid("token is empty");
        }
        final JwtClaims claims;
        try {
            claims = consumer().processToClaims(token);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                throw new AuthException.TokenExpired();
            }
            LOG.debugv("JWT verification failed: {0}", e.getMessage());
            throw new AuthException.TokenInvalid(summarizeJwtError(e));
        }
        return toPayload(claims);
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireIssuedAt()
                .setRequireExpirationTime()
                .setRequireJwtId()
                .setAllowedClockSkewInSeconds(0)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedIssuer(issuer)
                .setSkipDefaultAudienceValidation()
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .setVerificationKey(key)
                .build();
    }

    private TokenPayload toPayload(JwtClaims claims) {
        try {
            final TokenType type;
            try {
                type = TokenType.fromClaim(claims.getStringClaimValue(TYPE_CLAIM));
            } catch (IllegalArgumentException e) {
                throw new AuthException.TokenInvalid("unknown token type");
            }

            Map<String, Object> extras = new HashMap<>(claims.getClaimsMap());
            RESERVED_CLAIMS.forEach(extras::remove);

            return new TokenPayload(
                    claims.getSubject(),
                    type,
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()),
                    claims.getJwtId(),
                    claims.getStringClaimValue(SESSION_CLAIM),
                    extras);
        } catch (MalformedClaimException e) {
            throw new AuthException.TokenInvalid("malformed claims");
        }
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "signature mismatch";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return "unexpected issuer";
        }
        return "malformed token";
    }

    /**
     * Exception thrown when a token cannot be signed.
     */
    public static class TokenSigningException extends RuntimeException {
        public TokenSigningException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
