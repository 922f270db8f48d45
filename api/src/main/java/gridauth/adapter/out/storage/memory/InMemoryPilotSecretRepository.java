package gridauth.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.model.pilot.PilotSecretRecord;
import gridauth.core.port.out.PilotSecretRepository;

/**
 * In-memory pilot secret storage keyed by secret hash.
 */
public class InMemoryPilotSecretRepository implements PilotSecretRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryPilotSecretRepository.class);

    private final ConcurrentMap<String, PilotSecretRecord> secrets = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insert(PilotSecretRecord secret) {
        return Uni.createFrom().item(() -> secrets.putIfAbsent(secret.secretHash(), secret) == null);
    }

    @Override
    public Uni<Optional<PilotSecretRecord>> findByHash(String secretHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(secrets.get(secretHash)));
    }

    @Override
    public Uni<Boolean> replace(PilotSecretRecord expected, PilotSecretRecord replacement) {
        return Uni.createFrom().item(() -> secrets.replace(expected.secretHash(), expected, replacement));
    }

    @Override
    public Uni<Boolean> remove(PilotSecretRecord expected) {
        return Uni.createFrom().item(() -> secrets.remove(expected.secretHash(), expected));
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var secret : secrets.values()) {
                if (secret.isExpired(now) && secrets.remove(secret.secretHash(), secret)) {
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Purged %d expired pilot secrets", removed);
            }
            return removed;
        });
    }

    public int size() {
        return secrets.size();
    }
}
