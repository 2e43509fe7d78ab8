package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.mock.MutableClock;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should hide value once TTL elapses")
        void shouldHideValueOnceTtlElapses() {
            store.set("k", "v", Duration.ofSeconds(10)).await().indefinitely();

            clock.advance(Duration.ofSeconds(9));
            assertEquals(Optional.of("v"), store.get("k").await().indefinitely());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(store.get("k").await().indefinitely().isEmpty());
            assertFalse(store.exists("k").await().indefinitely());
        }

        @Test
        @DisplayName("setIfAbsent should succeed over an expired entry")
        void setIfAbsentShouldSucceedOverExpiredEntry() {
            store.set("k", "old", Duration.ofSeconds(1)).await().indefinitely();
            clock.advance(Duration.ofSeconds(2));

            assertTrue(store.setIfAbsent("k", "new", Duration.ofSeconds(5)).await().indefinitely());
            assertEquals(Optional.of("new"), store.get("k").await().indefinitely());
        }

        @Test
        @DisplayName("scan should skip expired keys")
        void scanShouldSkipExpiredKeys() {
            store.set("p:short", "v", Duration.ofSeconds(1)).await().indefinitely();
            store.set("p:long", "v", Duration.ofMinutes(1)).await().indefinitely();
            clock.advance(Duration.ofSeconds(5));

            assertEquals(List.of("p:long"), store.scan("p:*").await().indefinitely());
        }

        @Test
        @DisplayName("delete of expired key should report false")
        void deleteOfExpiredKeyShouldReportFalse() {
            store.set("k", "v", Duration.ofSeconds(1)).await().indefinitely();
            clock.advance(Duration.ofSeconds(1));

            assertFalse(store.delete("k").await().indefinitely());
        }

        @Test
        @DisplayName("cleanup should purge expired entries")
        void cleanupShouldPurgeExpiredEntries() {
            store.set("a", "v", Duration.ofSeconds(1)).await().indefinitely();
            store.set("b", "v", Duration.ofMinutes(1)).await().indefinitely();
            clock.advance(Duration.ofSeconds(30));

            store.cleanupExpired();

            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("should report remaining TTL")
        void shouldReportRemainingTtl() {
            store.set("k", "v", Duration.ofSeconds(60)).await().indefinitely();
            clock.advance(Duration.ofSeconds(15));

            assertEquals(Optional.of(Duration.ofSeconds(45)), store.remainingTtl("k"));
        }

        @Test
        @DisplayName("should reject non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> store.set("k", "v", Duration.ZERO).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("Sets")
    class SetTests {

        @Test
        @DisplayName("adding a member should refresh the set TTL")
        void addingMemberShouldRefreshSetTtl() {
            store.addToSet("s", "a", Duration.ofSeconds(10)).await().indefinitely();
            clock.advance(Duration.ofSeconds(8));
            store.addToSet("s", "b", Duration.ofSeconds(10)).await().indefinitely();
            clock.advance(Duration.ofSeconds(8));

            assertEquals(2, store.setMembers("s").await().indefinitely().size());
        }

        @Test
        @DisplayName("removing the last member should remove the key")
        void removingLastMemberShouldRemoveKey() {
            store.addToSet("s", "a", Duration.ofSeconds(10)).await().indefinitely();

            store.removeFromSet("s", "a").await().indefinitely();

            assertFalse(store.exists("s").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("globToRegex")
    class GlobTests {

        @Test
        @DisplayName("should treat regex metacharacters literally")
        void shouldTreatRegexMetacharactersLiterally() {
            var pattern = InMemoryKeyValueStore.globToRegex("token:metadata:u.1:*");

            assertTrue(pattern.matcher("token:metadata:u.1:abc").matches());
            assertFalse(pattern.matcher("token:metadata:uX1:abc").matches());
        }

        @Test
        @DisplayName("question mark should match one character")
        void questionMarkShouldMatchOneCharacter() {
            var pattern = InMemoryKeyValueStore.globToRegex("a?c");

            assertTrue(pattern.matcher("abc").matches());
            assertFalse(pattern.matcher("abbc").matches());
        }
    }
}
