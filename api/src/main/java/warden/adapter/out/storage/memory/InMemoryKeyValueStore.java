package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.KeyValueStore;

/**
 * In-memory implementation of KeyValueStore.
 *
 * <p>This implementation is intended for development and testing only.
 * State is lost on restart and not shared across instances.
 *
 * <p>Expiry is evaluated lazily against the supplied {@link Clock} on every
 * read, and a background task purges expired entries periodically.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryKeyValueStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "kv-store-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var intervalMs = Math.max(1, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Initialized in-memory key-value store");
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            requirePositive(ttl);
            entries.put(key, new Entry(value, null, expiryFor(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            requirePositive(ttl);
            final var inserted = new AtomicBoolean(false);
            entries.compute(key, (k, existing) -> {
                if (existing != null && !existing.isExpired(clock.instant())) {
                    return existing;
                }
                inserted.set(true);
                return new Entry(value, null, expiryFor(ttl));
            });
            return inserted.get();
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> live(key).map(Entry::value));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> live(key).isPresent());
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            final var removed = entries.remove(key);
            return removed != null && !removed.isExpired(clock.instant());
        });
    }

    @Override
    public Uni<List<String>> scan(String pattern) {
        return Uni.createFrom().item(() -> {
            final var regex = globToRegex(pattern);
            final var now = clock.instant();
            return entries.entrySet().stream()
                    .filter(e -> !e.getValue().isExpired(now))
                    .map(java.util.Map.Entry::getKey)
                    .filter(k -> regex.matcher(k).matches())
                    .toList();
        });
    }

    @Override
    public Uni<Void> addToSet(String key, String member, Duration ttl) {
        return Uni.createFrom().item(() -> {
            requirePositive(ttl);
            entries.compute(key, (k, existing) -> {
                final Set<String> members = existing == null || existing.isExpired(clock.instant())
                        ? new HashSet<>()
                        : new HashSet<>(existing.members());
                members.add(member);
                return new Entry(null, Set.copyOf(members), expiryFor(ttl));
            });
            return null;
        });
    }

    @Override
    public Uni<Set<String>> setMembers(String key) {
        return Uni.createFrom().item(() -> live(key).map(Entry::members).orElse(Set.of()));
    }

    @Override
    public Uni<Boolean> removeFromSet(String key, String member) {
        return Uni.createFrom().item(() -> {
            final var removed = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (existing.isExpired(clock.instant()) || existing.members() == null) {
                    return existing;
                }
                final Set<String> members = new HashSet<>(existing.members());
                removed.set(members.remove(member));
                // Redis removes a set once its last member is gone
                return members.isEmpty() ? null : new Entry(null, Set.copyOf(members), existing.expiresAt());
            });
            return removed.get();
        });
    }

    /**
     * Stop the background cleanup task.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
    }

    /**
     * Count live keys (for testing).
     *
     * @return number of non-expired keys
     */
    public int size() {
        final var now = clock.instant();
        return (int) entries.values().stream().filter(e -> !e.isExpired(now)).count();
    }

    /**
     * Return the remaining lifetime of a key (for testing).
     *
     * @param key the key
     * @return remaining TTL, or empty if absent
     */
    public Optional<Duration> remainingTtl(String key) {
        return live(key).map(e -> Duration.between(clock.instant(), e.expiresAt()));
    }

    void cleanupExpired() {
        final var now = clock.instant();
        final var before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Purged %d expired key(s)", removed);
        }
    }

    private Optional<Entry> live(String key) {
        final var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private Instant expiryFor(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
    }

    static Pattern globToRegex(String glob) {
        final var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(String value, Set<String> members, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
