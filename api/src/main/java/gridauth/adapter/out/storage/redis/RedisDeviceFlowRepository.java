package gridauth.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import gridauth.core.model.flow.DeviceFlowRecord;
import gridauth.core.port.out.DeviceFlowRepository;

/**
 * Redis implementation of device flow storage.
 *
 * <p>Key structure:
 * <ul>
 *   <li>{@code {prefix}flow:device:{deviceCodeHash}} - the flow as JSON</li>
 *   <li>{@code {prefix}flow:usercode:{userCode}} - device code hash</li>
 * </ul>
 * Both keys are written by one script so a user code is never bound to two flows.
 */
public class RedisDeviceFlowRepository implements DeviceFlowRepository {

    // KEYS[1] flow, KEYS[2] user code index; ARGV[1] JSON, ARGV[2] flow id, ARGV[3] ttl ms
    private static final String INSERT_SCRIPT = """
            if redis.call('EXISTS', KEYS[1]) == 1 or redis.call('EXISTS', KEYS[2]) == 1 then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[3])
            redis.call('SET', KEYS[2], ARGV[2], 'PX', ARGV[3])
            return 1
            """;

    private final RedisRecordStore<DeviceFlowRecord> store;
    private final String userCodePrefix;

    public RedisDeviceFlowRepository(
            ReactiveRedisDataSource dataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.store =
                new RedisRecordStore<>(dataSource, keyPrefix + "flow:device:", DeviceFlowRecord.class, timeoutHelper);
        this.userCodePrefix = keyPrefix + "flow:usercode:";
    }

    @Override
    public Uni<Boolean> insert(DeviceFlowRecord flow) {
        return store.execute(
                        "insert",
                        "EVAL",
                        INSERT_SCRIPT,
                        "2",
                        store.key(flow.id()),
                        userCodePrefix + flow.userCode(),
                        store.serialize(flow),
                        flow.id(),
                        RedisRecordStore.ttlMillis(flow.expiresAt()))
                .map(RedisRecordStore::isOne);
    }

    @Override
    public Uni<Optional<DeviceFlowRecord>> findById(String deviceCodeHash) {
        return store.get(deviceCodeHash);
    }

    @Override
    public Uni<Optional<DeviceFlowRecord>> findByUserCode(String userCode) {
        return store.execute("findByUserCode", "GET", userCodePrefix + userCode).flatMap(response -> {
            if (response == null) {
                return Uni.createFrom().item(Optional.<DeviceFlowRecord>empty());
            }
            return store.get(response.toString());
        });
    }

    @Override
    public Uni<Boolean> replace(DeviceFlowRecord expected, DeviceFlowRecord replacement) {
        return store.compareAndSet(expected.id(), expected, replacement);
    }

    /**
     * Flows expire through native key TTLs.
     */
    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(0);
    }
}
