package warden.adapter.out.user;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.user.User;
import warden.core.port.out.UserRepository;

/**
 * In-memory user repository.
 *
 * <p>Stands in for relational persistence of user rows, which lives outside
 * this service. Not shared across instances.
 */
@ApplicationScoped
public class InMemoryUserRepository implements UserRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryUserRepository.class);

    private final Map<String, User> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByEmail = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<User>> findByEmail(String email) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByEmail.get(email.toLowerCase(Locale.ROOT)))
                .map(byId::get));
    }

    @Override
    public Uni<Optional<User>> findById(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(byId.get(userId)));
    }

    @Override
    public Uni<User> save(User user) {
        return Uni.createFrom().item(() -> {
            final var previous = byId.put(user.id(), user);
            if (previous != null && !previous.email().equals(user.email())) {
                idByEmail.remove(previous.email(), user.id());
            }
            idByEmail.put(user.email(), user.id());
            LOG.debugf("Saved user %s", user.id());
            return user;
        });
    }
}
