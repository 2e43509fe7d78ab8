package warden.core.model.user;

/**
 * Cached subset of a user needed on the token refresh path.
 *
 * <p>Lockout state is not cached; it is always read from the user repository.
 *
 * @param userId   user id
 * @param email    user email
 * @param active   account active flag
 * @param verified email verified flag
 */
public record UserInfo(String userId, String email, boolean active, boolean verified) {

    public static UserInfo of(User user) {
        return new UserInfo(user.id(), user.email(), user.active(), user.verified());
    }
}
