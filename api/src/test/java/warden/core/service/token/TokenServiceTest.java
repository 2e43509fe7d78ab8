package warden.core.service.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.auth.HmacTokenCodec;
import warden.adapter.out.storage.memory.InMemoryKeyValueStore;
import warden.core.model.auth.AuthException;
import warden.core.model.token.TokenType;
import warden.core.port.out.AuthMetrics;
import warden.core.util.TokenDigest;
import warden.mock.MutableClock;
import warden.mock.TestConfigs;

@DisplayName("TokenService")
class TokenServiceTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private AuthMetrics metrics;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock, Duration.ofHours(1));
        metrics = mock(AuthMetrics.class);
        var codec = new HmacTokenCodec(TestConfigs.SECRET, "warden-test", clock);
        tokenService = new TokenService(
                codec, new RevocationRegistry(store), store, TestConfigs.token(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private String access(String userId) {
        return tokenService.issueAccessToken(userId, "sess-1", Map.of()).await().indefinitely();
    }

    private String refresh(String userId) {
        return tokenService.issueRefreshToken(userId, "sess-1", Map.of()).await().indefinitely();
    }

    @Nested
    @DisplayName("Issuing")
    class IssueTests {

        @Test
        @DisplayName("should write metadata living as long as the token")
        void shouldWriteMetadataWithTokenLifetime() {
            var token = access("user-1");

            var key = TokenService.metadataKey("user-1", TokenDigest.of(token));
            assertTrue(store.get(key).await().indefinitely().isPresent());
            assertEquals(Optional.of(TestConfigs.ACCESS_TTL), store.remainingTtl(key));
        }

        @Test
        @DisplayName("refresh token metadata should use the refresh lifetime")
        void refreshTokenShouldUseRefreshLifetime() {
            var token = refresh("user-1");

            var key = TokenService.metadataKey("user-1", TokenDigest.of(token));
            assertEquals(Optional.of(TestConfigs.REFRESH_TTL), store.remainingTtl(key));
        }

        @Test
        @DisplayName("should report access lifetime in seconds")
        void shouldReportAccessLifetimeInSeconds() {
            assertEquals(900, tokenService.accessTokenTtlSeconds());
        }
    }

    @Nested
    @DisplayName("validate()")
    class ValidateTests {

        @Test
        @DisplayName("should return payload for a valid token of the expected type")
        void shouldReturnPayloadForValidToken() {
            var token = access("user-1");

            var payload = tokenService.validate(token, TokenType.ACCESS).await().indefinitely();

            assertEquals("user-1", payload.subject());
            assertEquals(Optional.of("sess-1"), payload.sessionIdOpt());
        }

        @Test
        @DisplayName("should reject a token of the other type")
        void shouldRejectWrongType() {
            var token = refresh("user-1");

            var error = assertThrows(
                    AuthException.TokenWrongType.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
            assertEquals("token_wrong_type", error.code());
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            var token = access("user-1");
            clock.advance(TestConfigs.ACCESS_TTL);

            assertThrows(
                    AuthException.TokenExpired.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
        }

        @Test
        @DisplayName("should not write anything")
        void shouldNotWriteAnything() {
            var token = access("user-1");
            var before = store.size();

            tokenService.validate(token, TokenType.ACCESS).await().indefinitely();

            assertEquals(before, store.size());
        }
    }

    @Nested
    @DisplayName("revoke()")
    class RevokeTests {

        @Test
        @DisplayName("revoked token should fail validation until it expires, then report expiry")
        void revokedTokenShouldFailUntilExpiry() {
            var token = access("user-1");

            assertTrue(tokenService.revoke(token).await().indefinitely());

            assertThrows(
                    AuthException.TokenRevoked.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
            clock.advance(Duration.ofMinutes(14));
            assertThrows(
                    AuthException.TokenRevoked.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
            clock.advance(Duration.ofMinutes(1));
            assertThrows(
                    AuthException.TokenExpired.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
            verify(metrics).recordTokensRevoked(1);
        }

        @Test
        @DisplayName("tombstone TTL should equal the token's remaining lifetime")
        void tombstoneTtlShouldEqualRemainingLifetime() {
            var token = access("user-1");
            clock.advance(Duration.ofMinutes(5));

            tokenService.revoke(token).await().indefinitely();

            assertEquals(
                    Optional.of(Duration.ofMinutes(10)),
                    store.remainingTtl(RevocationRegistry.key(TokenDigest.of(token))));
        }

        @Test
        @DisplayName("revoking twice should be indistinguishable from revoking once")
        void revokingTwiceShouldBeIdempotent() {
            var token = access("user-1");

            tokenService.revoke(token).await().indefinitely();
            var sizeAfterFirst = store.size();
            tokenService.revoke(token).await().indefinitely();

            assertEquals(sizeAfterFirst, store.size());
            assertThrows(
                    AuthException.TokenRevoked.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
        }

        @Test
        @DisplayName("revoking an already expired token should succeed without writing a tombstone")
        void revokingExpiredTokenShouldWriteNothing() {
            var token = access("user-1");
            clock.advance(Duration.ofMinutes(20));

            assertFalse(tokenService.revoke(token).await().indefinitely());

            assertFalse(store.exists(RevocationRegistry.key(TokenDigest.of(token)))
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("revoking a malformed token should succeed as a no-op")
        void revokingMalformedTokenShouldBeNoOp() {
            var before = store.size();

            assertFalse(tokenService.revoke("garbage").await().indefinitely());
            assertEquals(before, store.size());
        }
    }

    @Nested
    @DisplayName("revokeAllForUser()")
    class RevokeAllTests {

        @Test
        @DisplayName("every token of the user should be revoked and others untouched")
        void everyTokenOfUserShouldBeRevoked() {
            List<String> tokens = new ArrayList<>();
            tokens.add(access("user-1"));
            tokens.add(access("user-1"));
            tokens.add(refresh("user-1"));
            var otherUsers = access("user-2");

            var revoked = tokenService.revokeAllForUser("user-1").await().indefinitely();

            assertEquals(3, revoked);
            for (String token : tokens) {
                var type = token.equals(tokens.get(2)) ? TokenType.REFRESH : TokenType.ACCESS;
                assertThrows(
                        AuthException.TokenRevoked.class,
                        () -> tokenService.validate(token, type).await().indefinitely());
            }
            assertEquals(
                    "user-2",
                    tokenService.validate(otherUsers, TokenType.ACCESS).await().indefinitely().subject());
            verify(metrics).recordTokensRevoked(3);
        }

        @Test
        @DisplayName("each tombstone should carry its own token's remaining lifetime")
        void eachTombstoneShouldCarryOwnLifetime() {
            var accessToken = access("user-1");
            var refreshToken = refresh("user-1");
            clock.advance(Duration.ofMinutes(1));

            tokenService.revokeAllForUser("user-1").await().indefinitely();

            assertEquals(
                    Optional.of(Duration.ofMinutes(14)),
                    store.remainingTtl(RevocationRegistry.key(TokenDigest.of(accessToken))));
            assertEquals(
                    Optional.of(TestConfigs.REFRESH_TTL.minusMinutes(1)),
                    store.remainingTtl(RevocationRegistry.key(TokenDigest.of(refreshToken))));
        }

        @Test
        @DisplayName("expired tokens should be skipped")
        void expiredTokensShouldBeSkipped() {
            access("user-1");
            var refreshToken = refresh("user-1");
            clock.advance(Duration.ofMinutes(16));

            var revoked = tokenService.revokeAllForUser("user-1").await().indefinitely();

            assertEquals(1, revoked);
            assertThrows(
                    AuthException.TokenRevoked.class,
                    () -> tokenService.validate(refreshToken, TokenType.REFRESH).await().indefinitely());
        }

        @Test
        @DisplayName("should return zero for a user without tokens")
        void shouldReturnZeroForUserWithoutTokens() {
            assertEquals(0, tokenService.revokeAllForUser("nobody").await().indefinitely());
        }

        @Test
        @DisplayName("re-running should be safe")
        void reRunningShouldBeSafe() {
            var token = access("user-1");

            tokenService.revokeAllForUser("user-1").await().indefinitely();
            tokenService.revokeAllForUser("user-1").await().indefinitely();

            assertThrows(
                    AuthException.TokenRevoked.class,
                    () -> tokenService.validate(token, TokenType.ACCESS).await().indefinitely());
        }
    }
}
