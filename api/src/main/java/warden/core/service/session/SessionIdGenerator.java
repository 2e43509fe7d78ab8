package warden.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates opaque session ids.
 *
 * <p>Ids are 24 random bytes (192 bits) from {@link SecureRandom}, URL-safe
 * Base64 without padding, so they can be embedded in store keys and in the
 * {@code sid} token claim as-is.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int ID_BYTES = 24;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * @return a new 32-character session id
     */
    public String generate() {
        final var bytes = new byte[ID_BYTES];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
