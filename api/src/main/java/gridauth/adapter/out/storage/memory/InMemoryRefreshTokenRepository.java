package gridauth.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.exception.ServerFaultException;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.port.out.RefreshTokenRepository;

/**
 * In-memory refresh token storage.
 *
 * <p>Lookups other than by jti scan all records, which is fine for the
 * development and test workloads this store is meant for.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRefreshTokenRepository.class);

    private final ConcurrentMap<String, RefreshTokenRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> insert(RefreshTokenRecord record) {
        return Uni.createFrom().item(() -> {
            if (records.putIfAbsent(record.jti(), record) != null) {
                throw new ServerFaultException("Duplicate refresh token jti: " + record.jti());
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByJti(String jti) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(jti)));
    }

    @Override
    public Uni<Boolean> replace(RefreshTokenRecord expected, RefreshTokenRecord replacement) {
        return Uni.createFrom().item(() -> records.replace(expected.jti(), expected, replacement));
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByRoot(String rootJti) {
        return select(record -> rootJti.equals(record.rootJti()));
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findBySubject(String subject) {
        return select(record -> subject.equals(record.subject()));
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByJobId(String jobId) {
        return select(record -> jobId.equals(record.jobId()));
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByPilotStamp(String pilotStamp) {
        return select(record -> pilotStamp.equals(record.pilotStamp()));
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var record : records.values()) {
                if (record.isExpired(now) && records.remove(record.jti(), record)) {
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Purged %d expired refresh token records", removed);
            }
            return removed;
        });
    }

    private Uni<List<RefreshTokenRecord>> select(Predicate<RefreshTokenRecord> filter) {
        return Uni.createFrom()
                .item(() -> records.values().stream().filter(filter).toList());
    }

    public int size() {
        return records.size();
    }
}
