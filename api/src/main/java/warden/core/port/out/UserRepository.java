package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.user.User;

/**
 * Port interface for user persistence.
 */
public interface UserRepository {

    /**
     * Find a user by normalized email.
     *
     * @param email lower-case email
     * @return the user, or empty
     */
    Uni<Optional<User>> findByEmail(String email);

    Uni<Optional<User>> findById(String userId);

    /**
     * Insert or replace a user.
     *
     * @param user the user
     * @return the saved user
     */
    Uni<User> save(User user);
}
