package gridauth.adapter.out.storage.redis;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import gridauth.core.model.pilot.PilotSecretRecord;
import gridauth.core.port.out.PilotSecretRepository;

/**
 * Redis implementation of pilot secret storage.
 *
 * <p>Secrets live under {@code {prefix}pilot:secret:{hash}} and expire with the secret.
 * Stamp and site constraints are stored as sorted lists so the serialized form
 * used for compare-and-swap is stable.
 */
public class RedisPilotSecretRepository implements PilotSecretRepository {

    private final RedisRecordStore<StoredSecret> store;

    public RedisPilotSecretRepository(
            ReactiveRedisDataSource dataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.store = new RedisRecordStore<>(dataSource, keyPrefix + "pilot:secret:", StoredSecret.class, timeoutHelper);
    }

    @Override
    public Uni<Boolean> insert(PilotSecretRecord secret) {
        return store.insertIfAbsent(secret.secretHash(), StoredSecret.from(secret), secret.expiresAt());
    }

    @Override
    public Uni<Optional<PilotSecretRecord>> findByHash(String secretHash) {
        return store.get(secretHash).map(stored -> stored.map(StoredSecret::toRecord));
    }

    @Override
    public Uni<Boolean> replace(PilotSecretRecord expected, PilotSecretRecord replacement) {
        return store.compareAndSet(
                expected.secretHash(), StoredSecret.from(expected), StoredSecret.from(replacement));
    }

    @Override
    public Uni<Boolean> remove(PilotSecretRecord expected) {
        return store.compareAndDelete(expected.secretHash(), StoredSecret.from(expected));
    }

    /**
     * Secrets expire through native key TTLs.
     */
    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(0);
    }

    record StoredSecret(
            String secretHash,
            String vo,
            List<String> pilotStamps,
            List<String> sites,
            int maxUses,
            int useCount,
            Instant createdAt,
            Instant expiresAt,
            Instant lastUsedAt) {

        static StoredSecret from(PilotSecretRecord secret) {
            return new StoredSecret(
                    secret.secretHash(),
                    secret.vo(),
                    secret.pilotStamps().stream().sorted().toList(),
                    secret.sites().stream().sorted().toList(),
                    secret.maxUses(),
                    secret.useCount(),
                    secret.createdAt(),
                    secret.expiresAt(),
                    secret.lastUsedAt());
        }

        PilotSecretRecord toRecord() {
            return new PilotSecretRecord(
                    secretHash,
                    vo,
                    Set.copyOf(pilotStamps),
                    Set.copyOf(sites),
                    maxUses,
                    useCount,
                    createdAt,
                    expiresAt,
                    lastUsedAt);
        }
    }
}
