package gridauth.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import gridauth.core.model.flow.AuthorizationFlowRecord;
import gridauth.core.port.out.AuthorizationFlowRepository;

/**
 * Redis implementation of authorization flow storage.
 *
 * <p>Key structure:
 * <ul>
 *   <li>{@code {prefix}flow:auth:{id}} - the flow as JSON, expiring with the flow</li>
 *   <li>{@code {prefix}flow:code:{codeHash}} - flow id, written once the flow is authorized</li>
 * </ul>
 */
public class RedisAuthorizationFlowRepository implements AuthorizationFlowRepository {

    private final RedisRecordStore<AuthorizationFlowRecord> store;
    private final String codeIndexPrefix;

    public RedisAuthorizationFlowRepository(
            ReactiveRedisDataSource dataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.store = new RedisRecordStore<>(
                dataSource, keyPrefix + "flow:auth:", AuthorizationFlowRecord.class, timeoutHelper);
        this.codeIndexPrefix = keyPrefix + "flow:code:";
    }

    @Override
    public Uni<Boolean> insert(AuthorizationFlowRecord flow) {
        return store.insertIfAbsent(flow.id(), flow, flow.expiresAt());
    }

    @Override
    public Uni<Optional<AuthorizationFlowRecord>> findById(String id) {
        return store.get(id);
    }

    @Override
    public Uni<Optional<AuthorizationFlowRecord>> findByCodeHash(String codeHash) {
        return store.execute("findByCodeHash", "GET", codeIndexPrefix + codeHash).flatMap(response -> {
            if (response == null) {
                return Uni.createFrom().item(Optional.<AuthorizationFlowRecord>empty());
            }
            return store.get(response.toString())
                    .map(flow -> flow.filter(f -> codeHash.equals(f.codeHash())));
        });
    }

    @Override
    public Uni<Boolean> replace(AuthorizationFlowRecord expected, AuthorizationFlowRecord replacement) {
        return store.compareAndSet(expected.id(), expected, replacement).flatMap(swapped -> {
            if (!swapped || replacement.codeHash() == null || replacement.codeHash().equals(expected.codeHash())) {
                return Uni.createFrom().item(swapped);
            }
            return store.execute(
                            "indexCode",
                            "SET",
                            codeIndexPrefix + replacement.codeHash(),
                            replacement.id(),
                            "PX",
                            RedisRecordStore.ttlMillis(replacement.expiresAt()))
                    .replaceWith(true);
        });
    }

    /**
     * Flows expire through native key TTLs.
     */
    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(0);
    }
}
