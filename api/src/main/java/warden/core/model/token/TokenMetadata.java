package warden.core.model.token;

import java.time.Instant;

/**
 * Bookkeeping entry written for every issued token so a user's live tokens
 * can be found for bulk revocation.
 *
 * @param userId    token subject
 * @param tokenType token type
 * @param createdAt issue time
 * @param expiresAt natural expiry
 */
public record TokenMetadata(String userId, TokenType tokenType, Instant createdAt, Instant expiresAt) {}
