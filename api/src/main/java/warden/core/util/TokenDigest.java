package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests of bearer tokens.
 *
 * <p>Store keys and log lines refer to tokens by digest so raw credentials
 * are never written anywhere.
 */
public final class TokenDigest {

    private static final int LOG_PREFIX_CHARS = 12;

    private TokenDigest() {}

    /**
     * Return the full lower-case hex SHA-256 digest of a token.
     *
     * @param token the raw token
     * @return 64 hex characters
     */
    public static String of(String token) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 not available", e);
        }
    }

    /**
     * Return a short digest prefix suitable for log messages.
     *
     * @param token the raw token
     * @return first 12 hex characters of the digest
     */
    public static String forLog(String token) {
        return of(token).substring(0, LOG_PREFIX_CHARS);
    }
}
