package warden.core.service.token;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.KeyValueStore;

/**
 * Blacklist of revoked tokens.
 *
 * <p>Tokens are identified by their SHA-256 digest. Each tombstone lives
 * exactly as long as the token it blocks would have stayed valid, so the
 * blacklist only ever holds entries for tokens that are still unexpired.
 */
@ApplicationScoped
public class RevocationRegistry {

    private static final Logger LOG = Logger.getLogger(RevocationRegistry.class);

    static final String KEY_PREFIX = "token:blacklist:";
    private static final String TOMBSTONE = "1";

    private final KeyValueStore store;

    @Inject
    public RevocationRegistry(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Blacklist a token for the rest of its natural lifetime.
     *
     * <p>A token with no remaining lifetime is already unusable and is not
     * recorded. Revoking the same token again simply rewrites the tombstone.
     *
     * @param tokenDigest SHA-256 digest of the token
     * @param remainingTtl time until the token expires on its own
     * @return true if a tombstone was written
     */
    public Uni<Boolean> revoke(String tokenDigest, Duration remainingTtl) {
        if (remainingTtl.isZero() || remainingTtl.isNegative()) {
            LOG.debugf("Token %s already expired, nothing to revoke", shortDigest(tokenDigest));
            return Uni.createFrom().item(false);
        }
        return store.set(key(tokenDigest), TOMBSTONE, remainingTtl)
                .invoke(() -> LOG.debugf("Revoked token %s for %s", shortDigest(tokenDigest), remainingTtl))
                .replaceWith(true);
    }

    /**
     * Check whether a token has been revoked.
     *
     * @param tokenDigest SHA-256 digest of the token
     * @return true if a tombstone exists
     */
    public Uni<Boolean> isRevoked(String tokenDigest) {
        return store.exists(key(tokenDigest));
    }

    static String key(String tokenDigest) {
        return KEY_PREFIX + tokenDigest;
    }

    private static String shortDigest(String tokenDigest) {
        return tokenDigest.length() > 12 ? tokenDigest.substring(0, 12) : tokenDigest;
    }
}
