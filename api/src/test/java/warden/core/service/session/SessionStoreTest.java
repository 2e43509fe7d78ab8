package warden.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryKeyValueStore;
import warden.core.model.auth.AuthException;
import warden.core.model.session.SessionUpdate;
import warden.core.port.in.SessionManagement.SessionCreationException;
import warden.mock.MutableClock;

@DisplayName("SessionStore")
class SessionStoreTest {

    private static final Duration TTL = Duration.ofDays(7);

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private SessionStore sessions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T09:00:00Z");
        store = new InMemoryKeyValueStore(clock, Duration.ofHours(1));
        sessions = new SessionStore(store, new SessionIdGenerator(), TTL, clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private String create(String userId) {
        return sessions.create(userId, Map.of("device", "laptop"), "10.0.0.1", "Mozilla/5.0")
                .await()
                .indefinitely();
    }

    @Nested
    @DisplayName("create()")
    class CreateTests {

        @Test
        @DisplayName("should store record with all properties")
        void shouldStoreRecord() {
            var id = create("user-1");

            var record = sessions.get(id).await().indefinitely();

            assertEquals("user-1", record.userId());
            assertEquals("10.0.0.1", record.ipAddress());
            assertEquals("Mozilla/5.0", record.userAgent());
            assertEquals("laptop", record.data().get("device"));
            assertEquals(clock.instant(), record.createdAt());
            assertEquals(record.createdAt(), record.lastAccessedAt());
        }

        @Test
        @DisplayName("expiry should equal creation time plus refresh lifetime")
        void expiryShouldMatchRefreshLifetime() {
            var id = create("user-1");

            var record = sessions.get(id).await().indefinitely();

            assertEquals(record.createdAt().plus(TTL), record.expiresAt());
            assertEquals(TTL, store.remainingTtl(SessionStore.key(id)).orElseThrow());
        }

        @Test
        @DisplayName("creation time should be truncated to whole seconds")
        void creationTimeShouldBeWholeSeconds() {
            clock.set(Instant.parse("2026-04-01T09:00:00.900Z"));

            var record = sessions.get(create("user-1")).await().indefinitely();

            assertEquals(Instant.parse("2026-04-01T09:00:00Z"), record.createdAt());
        }

        @Test
        @DisplayName("should generate unique ids")
        void shouldGenerateUniqueIds() {
            assertNotEquals(create("user-1"), create("user-1"));
        }

        @Test
        @DisplayName("should add the session to the user index")
        void shouldIndexSession() {
            var id = create("user-1");

            assertEquals(
                    Set.of(id),
                    store.setMembers(SessionStore.userIndexKey("user-1")).await().indefinitely());
        }

        @Test
        @DisplayName("should give up after repeated id collisions")
        void shouldGiveUpAfterCollisions() {
            var generator = mock(SessionIdGenerator.class);
            when(generator.generate()).thenReturn("taken");
            var colliding = new SessionStore(store, generator, TTL, clock);
            colliding.create("user-1", Map.of(), null, null).await().indefinitely();

            assertThrows(
                    SessionCreationException.class,
                    () -> colliding.create("user-2", Map.of(), null, null).await().indefinitely());
        }

        @Test
        @DisplayName("should retry with a fresh id after a collision")
        void shouldRetryAfterCollision() {
            var generator = mock(SessionIdGenerator.class);
            when(generator.generate()).thenReturn("taken", "taken", "fresh");
            var colliding = new SessionStore(store, generator, TTL, clock);
            colliding.create("user-1", Map.of(), null, null).await().indefinitely();

            var id = colliding.create("user-2", Map.of(), null, null).await().indefinitely();

            assertEquals("fresh", id);
        }
    }

    @Nested
    @DisplayName("get() and find()")
    class GetTests {

        @Test
        @DisplayName("get should fail for unknown session")
        void getShouldFailForUnknownSession() {
            var error = assertThrows(
                    AuthException.SessionNotFound.class,
                    () -> sessions.get("missing").await().indefinitely());
            assertEquals("session_not_found", error.code());
        }

        @Test
        @DisplayName("session should be gone once expired")
        void sessionShouldBeGoneOnceExpired() {
            var id = create("user-1");
            clock.advance(TTL);

            assertTrue(sessions.find(id).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("update()")
    class UpdateTests {

        @Test
        @DisplayName("touch should re-extend expiry from the access time")
        void touchShouldReExtendExpiry() {
            var id = create("user-1");
            clock.advance(Duration.ofDays(3));
            var accessedAt = clock.instant();

            var updated = sessions.update(id, SessionUpdate.touch(accessedAt)).await().indefinitely();

            assertEquals(accessedAt, updated.lastAccessedAt());
            assertEquals(accessedAt.plus(TTL), updated.expiresAt());
            assertEquals(TTL, store.remainingTtl(SessionStore.key(id)).orElseThrow());
            clock.advance(Duration.ofDays(5));
            assertTrue(sessions.find(id).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("data update should merge and keep expiry")
        void dataUpdateShouldMergeAndKeepExpiry() {
            var id = create("user-1");
            var before = sessions.get(id).await().indefinitely();
            clock.advance(Duration.ofHours(1));

            var updated = sessions.update(id, SessionUpdate.data(Map.of("theme", "dark")))
                    .await()
                    .indefinitely();

            assertEquals("laptop", updated.data().get("device"));
            assertEquals("dark", updated.data().get("theme"));
            assertEquals(before.expiresAt(), updated.expiresAt());
            assertEquals(TTL.minusHours(1), store.remainingTtl(SessionStore.key(id)).orElseThrow());
        }

        @Test
        @DisplayName("update of unknown session should fail")
        void updateOfUnknownSessionShouldFail() {
            assertThrows(
                    AuthException.SessionNotFound.class,
                    () -> sessions.update("missing", SessionUpdate.touch(clock.instant()))
                            .await()
                            .indefinitely());
        }
    }

    @Nested
    @DisplayName("delete()")
    class DeleteTests {

        @Test
        @DisplayName("should delete record and index entry")
        void shouldDeleteRecordAndIndexEntry() {
            var id = create("user-1");
            var other = create("user-1");

            assertTrue(sessions.delete(id).await().indefinitely());

            assertThrows(AuthException.SessionNotFound.class, () -> sessions.get(id).await().indefinitely());
            assertEquals(List.of(other), sessions.findByUser("user-1").await().indefinitely());
        }

        @Test
        @DisplayName("deleting a missing session should report false")
        void deletingMissingSessionShouldReportFalse() {
            assertFalse(sessions.delete("missing").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("Per-user index")
    class IndexTests {

        @Test
        @DisplayName("findByUser should list only that user's sessions")
        void findByUserShouldListOnlyThatUser() {
            var a = create("user-1");
            var b = create("user-1");
            create("user-2");

            assertEquals(Set.of(a, b), Set.copyOf(sessions.findByUser("user-1").await().indefinitely()));
        }

        @Test
        @DisplayName("stale index entries should be pruned while listing")
        void staleEntriesShouldBePruned() {
            var stale = create("user-1");
            var live = create("user-1");
            store.delete(SessionStore.key(stale)).await().indefinitely();

            assertEquals(List.of(live), sessions.findByUser("user-1").await().indefinitely());
            assertEquals(
                    Set.of(live),
                    store.setMembers(SessionStore.userIndexKey("user-1")).await().indefinitely());
        }

        @Test
        @DisplayName("deleteAllForUser should remove every session and the index")
        void deleteAllForUserShouldRemoveEverything() {
            var a = create("user-1");
            var b = create("user-1");
            var other = create("user-2");

            assertEquals(2, sessions.deleteAllForUser("user-1").await().indefinitely());

            assertTrue(sessions.findByUser("user-1").await().indefinitely().isEmpty());
            assertFalse(store.exists(SessionStore.userIndexKey("user-1")).await().indefinitely());
            assertTrue(sessions.find(a).await().indefinitely().isEmpty());
            assertTrue(sessions.find(b).await().indefinitely().isEmpty());
            assertTrue(sessions.find(other).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("deleteAllForUser should return zero when the user has no sessions")
        void deleteAllForUserShouldReturnZeroWhenEmpty() {
            assertEquals(0, sessions.deleteAllForUser("nobody").await().indefinitely());
        }
    }
}
