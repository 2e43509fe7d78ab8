package warden.core.port.out;

/**
 * Port interface for one-way password hashing.
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    /**
     * Compare a raw password against a stored hash.
     *
     * @param rawPassword password supplied by the user
     * @param hash stored hash
     * @return true if they match
     */
    boolean compare(String rawPassword, String hash);
}
