package warden.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import at.favre.lib.crypto.bcrypt.BCrypt;

import warden.core.config.PasswordConfig;
import warden.core.port.out.PasswordHasher;

/**
 * bcrypt implementation of {@link PasswordHasher}.
 */
@ApplicationScoped
public class BcryptPasswordHasher implements PasswordHasher {

    private final int cost;

    @Inject
    public BcryptPasswordHasher(PasswordConfig config) {
        this(config.bcryptCost());
    }

    public BcryptPasswordHasher(int cost) {
        if (cost < 4 || cost > 31) {
            throw new IllegalArgumentException("bcrypt cost must be between 4 and 31, got " + cost);
        }
        this.cost = cost;
    }

    @Override
    public String hash(String rawPassword) {
        return BCrypt.withDefaults().hashToString(cost, rawPassword.toCharArray());
    }

    @Override
    public boolean compare(String rawPassword, String hash) {
        if (rawPassword == null || hash == null) {
            return false;
        }
        return BCrypt.verifyer().verify(rawPassword.toCharArray(), hash).verified;
    }
}
