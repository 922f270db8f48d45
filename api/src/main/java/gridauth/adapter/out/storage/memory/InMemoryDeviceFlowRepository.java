package gridauth.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.model.flow.DeviceFlowRecord;
import gridauth.core.port.out.DeviceFlowRepository;

/**
 * In-memory device flow storage with a user code index.
 *
 * <p>Flows are lost on restart and not shared across instances.
 */
public class InMemoryDeviceFlowRepository implements DeviceFlowRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryDeviceFlowRepository.class);

    private final ConcurrentMap<String, DeviceFlowRecord> flows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idsByUserCode = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insert(DeviceFlowRecord flow) {
        return Uni.createFrom().item(() -> {
            if (idsByUserCode.putIfAbsent(flow.userCode(), flow.id()) != null) {
                return false;
            }
            if (flows.putIfAbsent(flow.id(), flow) != null) {
                idsByUserCode.remove(flow.userCode(), flow.id());
                return false;
            }
            return true;
        });
    }

    @Override
    public Uni<Optional<DeviceFlowRecord>> findById(String deviceCodeHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(flows.get(deviceCodeHash)));
    }

    @Override
    public Uni<Optional<DeviceFlowRecord>> findByUserCode(String userCode) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(idsByUserCode.get(userCode)).map(flows::get));
    }

    @Override
    public Uni<Boolean> replace(DeviceFlowRecord expected, DeviceFlowRecord replacement) {
        return Uni.createFrom().item(() -> flows.replace(expected.id(), expected, replacement));
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var flow : flows.values()) {
                if (flow.isExpired(now) && flows.remove(flow.id(), flow)) {
                    idsByUserCode.remove(flow.userCode(), flow.id());
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Purged %d expired device flows", removed);
            }
            return removed;
        });
    }

    public int size() {
        return flows.size();
    }
}
