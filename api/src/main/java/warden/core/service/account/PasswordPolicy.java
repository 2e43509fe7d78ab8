package warden.core.service.account;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.PasswordConfig;
import warden.core.model.auth.AuthException;

/**
 * Strength rules for new passwords.
 *
 * <p>A password needs the configured minimum length and at least one
 * upper-case letter, one lower-case letter and one digit.
 */
@ApplicationScoped
public class PasswordPolicy {

    private final int minLength;

    @Inject
    public PasswordPolicy(PasswordConfig config) {
        this(config.minLength());
    }

    public PasswordPolicy(int minLength) {
        this.minLength = minLength;
    }

    /**
     * Check a candidate password.
     *
     * @param password raw password
     * @throws AuthException.InvalidPassword if a rule is violated
     */
    public void validate(String password) {
        if (password == null || password.isEmpty()) {
            throw new AuthException.InvalidPassword("Password cannot be empty");
        }
        if (password.length() < minLength) {
            throw new AuthException.InvalidPassword("Password must be at least " + minLength + " characters long");
        }
        final var hasUpper = password.chars().anyMatch(Character::isUpperCase);
        final var hasLower = password.chars().anyMatch(Character::isLowerCase);
        final var hasDigit = password.chars().anyMatch(Character::isDigit);
        if (!hasUpper || !hasLower || !hasDigit) {
            throw new AuthException.InvalidPassword(
                    "Password must contain at least one uppercase letter, one lowercase letter, and one number");
        }
    }
}
