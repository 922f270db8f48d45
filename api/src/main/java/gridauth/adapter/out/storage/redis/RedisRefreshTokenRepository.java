package gridauth.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.exception.ServerFaultException;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.port.out.RefreshTokenRepository;

/**
 * Redis implementation of refresh token storage.
 *
 * <p>Key structure:
 * <ul>
 *   <li>{@code {prefix}rt:{jti}} - the record as JSON, expiring with the record</li>
 *   <li>{@code {prefix}rt:root:{rootJti}} - set of jtis in a rotation chain</li>
 *   <li>{@code {prefix}rt:sub:{subject}} - set of jtis of a subject</li>
 *   <li>{@code {prefix}rt:job:{jobId}} - set of jtis backing a job's credentials</li>
 *   <li>{@code {prefix}rt:pilot:{stamp}} - set of jtis of a pilot</li>
 * </ul>
 * Index sets live as long as their longest-lived member. Members whose record
 * has expired are skipped on read.
 */
public class RedisRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(RedisRefreshTokenRepository.class);

    // KEYS[1] record, KEYS[2..n] index sets; ARGV[1] JSON, ARGV[2] ttl ms, ARGV[3] jti
    private static final String INSERT_SCRIPT = """
            if not redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2], 'NX') then
              return 0
            end
            for i = 2, #KEYS do
              redis.call('SADD', KEYS[i], ARGV[3])
              if redis.call('PTTL', KEYS[i]) < tonumber(ARGV[2]) then
                redis.call('PEXPIRE', KEYS[i], ARGV[2])
              end
            end
            return 1
            """;

    private final RedisRecordStore<RefreshTokenRecord> store;
    private final String rootPrefix;
    private final String subjectPrefix;
    private final String jobPrefix;
    private final String pilotPrefix;

    public RedisRefreshTokenRepository(
            ReactiveRedisDataSource dataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.store = new RedisRecordStore<>(dataSource, keyPrefix + "rt:", RefreshTokenRecord.class, timeoutHelper);
        this.rootPrefix = keyPrefix + "rt:root:";
        this.subjectPrefix = keyPrefix + "rt:sub:";
        this.jobPrefix = keyPrefix + "rt:job:";
        this.pilotPrefix = keyPrefix + "rt:pilot:";
    }

    @Override
    public Uni<Void> insert(RefreshTokenRecord record) {
        final var keys = new ArrayList<String>();
        keys.add(store.key(record.jti()));
        keys.add(rootPrefix + record.rootJti());
        keys.add(subjectPrefix + record.subject());
        if (record.jobId() != null) {
            keys.add(jobPrefix + record.jobId());
        }
        if (record.pilotStamp() != null) {
            keys.add(pilotPrefix + record.pilotStamp());
        }

        final var args = new ArrayList<String>();
        args.add(INSERT_SCRIPT);
        args.add(String.valueOf(keys.size()));
        args.addAll(keys);
        args.add(store.serialize(record));
        args.add(RedisRecordStore.ttlMillis(record.expiresAt()));
        args.add(record.jti());

        return store.execute("insert", "EVAL", args.toArray(String[]::new)).map(response -> {
            if (!RedisRecordStore.isOne(response)) {
                throw new ServerFaultException("Duplicate refresh token jti: " + record.jti());
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByJti(String jti) {
        return store.get(jti);
    }

    @Override
    public Uni<Boolean> replace(RefreshTokenRecord expected, RefreshTokenRecord replacement) {
        return store.compareAndSet(expected.jti(), expected, replacement);
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByRoot(String rootJti) {
        return findByIndex(rootPrefix + rootJti);
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findBySubject(String subject) {
        return findByIndex(subjectPrefix + subject);
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByJobId(String jobId) {
        return findByIndex(jobPrefix + jobId);
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findByPilotStamp(String pilotStamp) {
        return findByIndex(pilotPrefix + pilotStamp);
    }

    /**
     * Records and index sets expire through native key TTLs.
     */
    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(0);
    }

    private Uni<List<RefreshTokenRecord>> findByIndex(String indexKey) {
        return store.execute("findByIndex", "SMEMBERS", indexKey).flatMap(response -> {
            final var jtis = new ArrayList<String>();
            if (response != null) {
                for (var i = 0; i < response.size(); i++) {
                    jtis.add(response.get(i).toString());
                }
            }
            LOG.debugf("Index %s holds %d refresh tokens", indexKey, jtis.size());
            return store.getAll(jtis);
        });
    }
}
