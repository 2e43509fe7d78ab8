package warden.core.port.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Contract tests for KeyValueStore implementations.
 *
 * <p>Extend this class and implement {@link #createStore()} to check that a
 * store behaves the way the token, session and security-log services expect.
 */
public abstract class KeyValueStoreContractTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    protected abstract KeyValueStore createStore();

    private KeyValueStore store;
    private String prefix;

    @BeforeEach
    void setUpContract() {
        store = createStore();
        prefix = "contract:" + UUID.randomUUID() + ":";
    }

    private String key(String suffix) {
        return prefix + suffix;
    }

    @Nested
    @DisplayName("set() and get()")
    class SetAndGetTests {

        @Test
        @DisplayName("should return stored value")
        void shouldReturnStoredValue() {
            store.set(key("a"), "value", TTL).await().indefinitely();

            assertEquals(Optional.of("value"), store.get(key("a")).await().indefinitely());
        }

        @Test
        @DisplayName("should return empty for missing key")
        void shouldReturnEmptyForMissingKey() {
            assertTrue(store.get(key("missing")).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should overwrite existing value")
        void shouldOverwriteExistingValue() {
            store.set(key("a"), "first", TTL).await().indefinitely();
            store.set(key("a"), "second", TTL).await().indefinitely();

            assertEquals(Optional.of("second"), store.get(key("a")).await().indefinitely());
        }

        @Test
        @DisplayName("exists should reflect presence")
        void existsShouldReflectPresence() {
            assertFalse(store.exists(key("a")).await().indefinitely());

            store.set(key("a"), "v", TTL).await().indefinitely();

            assertTrue(store.exists(key("a")).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("setIfAbsent()")
    class SetIfAbsentTests {

        @Test
        @DisplayName("should write only the first time")
        void shouldWriteOnlyTheFirstTime() {
            assertTrue(store.setIfAbsent(key("a"), "first", TTL).await().indefinitely());
            assertFalse(store.setIfAbsent(key("a"), "second", TTL).await().indefinitely());

            assertEquals(Optional.of("first"), store.get(key("a")).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("delete()")
    class DeleteTests {

        @Test
        @DisplayName("should report whether a key was removed")
        void shouldReportWhetherKeyWasRemoved() {
            store.set(key("a"), "v", TTL).await().indefinitely();

            assertTrue(store.delete(key("a")).await().indefinitely());
            assertFalse(store.delete(key("a")).await().indefinitely());
            assertFalse(store.exists(key("a")).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("scan()")
    class ScanTests {

        @Test
        @DisplayName("should list keys matching a prefix pattern")
        void shouldListKeysMatchingPrefixPattern() {
            store.set(key("user1:t1"), "v", TTL).await().indefinitely();
            store.set(key("user1:t2"), "v", TTL).await().indefinitely();
            store.set(key("user2:t1"), "v", TTL).await().indefinitely();

            var keys = new HashSet<>(store.scan(key("user1:*")).await().indefinitely());

            assertEquals(Set.of(key("user1:t1"), key("user1:t2")), keys);
        }

        @Test
        @DisplayName("should return empty list when nothing matches")
        void shouldReturnEmptyListWhenNothingMatches() {
            assertTrue(store.scan(key("none:*")).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("set operations")
    class SetOperationTests {

        @Test
        @DisplayName("should add and list members")
        void shouldAddAndListMembers() {
            store.addToSet(key("set"), "a", TTL).await().indefinitely();
            store.addToSet(key("set"), "b", TTL).await().indefinitely();
            store.addToSet(key("set"), "a", TTL).await().indefinitely();

            assertEquals(Set.of("a", "b"), store.setMembers(key("set")).await().indefinitely());
        }

        @Test
        @DisplayName("should remove members")
        void shouldRemoveMembers() {
            store.addToSet(key("set"), "a", TTL).await().indefinitely();
            store.addToSet(key("set"), "b", TTL).await().indefinitely();

            assertTrue(store.removeFromSet(key("set"), "a").await().indefinitely());
            assertFalse(store.removeFromSet(key("set"), "a").await().indefinitely());
            assertEquals(Set.of("b"), store.setMembers(key("set")).await().indefinitely());
        }

        @Test
        @DisplayName("should return empty set for missing key")
        void shouldReturnEmptySetForMissingKey() {
            assertTrue(store.setMembers(key("nothing")).await().indefinitely().isEmpty());
        }
    }
}
