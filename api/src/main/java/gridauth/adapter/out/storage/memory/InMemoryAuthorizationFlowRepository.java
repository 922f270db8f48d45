package gridauth.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.model.flow.AuthorizationFlowRecord;
import gridauth.core.port.out.AuthorizationFlowRepository;

/**
 * In-memory authorization flow storage.
 *
 * <p>Flows are lost on restart and not shared across instances.
 */
public class InMemoryAuthorizationFlowRepository implements AuthorizationFlowRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthorizationFlowRepository.class);

    private final ConcurrentMap<String, AuthorizationFlowRecord> flows = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insert(AuthorizationFlowRecord flow) {
        return Uni.createFrom().item(() -> flows.putIfAbsent(flow.id(), flow) == null);
    }

    @Override
    public Uni<Optional<AuthorizationFlowRecord>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(flows.get(id)));
    }

    @Override
    public Uni<Optional<AuthorizationFlowRecord>> findByCodeHash(String codeHash) {
        return Uni.createFrom().item(() -> flows.values().stream()
                .filter(flow -> codeHash.equals(flow.codeHash()))
                .findFirst());
    }

    @Override
    public Uni<Boolean> replace(AuthorizationFlowRecord expected, AuthorizationFlowRecord replacement) {
        return Uni.createFrom().item(() -> flows.replace(expected.id(), expected, replacement));
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var flow : flows.values()) {
                if (flow.isExpired(now) && flows.remove(flow.id(), flow)) {
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Purged %d expired authorization flows", removed);
            }
            return removed;
        });
    }

    public int size() {
        return flows.size();
    }
}
