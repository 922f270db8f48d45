package gridauth.adapter.out.auth;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.KeyRotationConfig;
import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.SigningKeyRecord;
import gridauth.spi.SigningKeyRepository;

/**
 * Default signing key repository.
 *
 * <p>Loads an optional bootstrap key from {@code gridauth.auth.keys.bootstrap-key}
 * and keeps every other key in memory.
 *
 * <p><strong>Warning:</strong> generated keys are lost on restart and not shared
 * across instances. Multi-instance deployments should provide a persistent
 * {@link SigningKeyRepository}.
 */
@ApplicationScoped
public class ConfigSigningKeyRepository implements SigningKeyRepository {

    private static final Logger LOG = Logger.getLogger(ConfigSigningKeyRepository.class);

    private static final Comparator<SigningKeyRecord> BY_ACTIVATION = Comparator.comparing(
            key -> key.activatedAt() != null ? key.activatedAt() : key.createdAt());

    private final ConcurrentMap<String, SigningKeyRecord> keys = new ConcurrentHashMap<>();

    @Inject
    public ConfigSigningKeyRepository(KeyRotationConfig config) {
        config.bootstrapKey().ifPresent(pem -> loadBootstrapKey(pem, config.bootstrapKeyId()));
    }

    private void loadBootstrapKey(String pem, String keyId) {
        try {
            final var privateKey = SigningKeyRecord.parsePrivateKey(pem);
            final var publicKey = SigningKeyRecord.derivePublicKey(privateKey);
            keys.put(keyId, SigningKeyRecord.active(keyId, privateKey, publicKey, Instant.now()));
            LOG.infov("Loaded bootstrap signing key: {0}", keyId);
        } catch (IllegalArgumentException e) {
            LOG.errorv(e, "Failed to load bootstrap signing key {0}", keyId);
        }
    }

    @Override
    public Uni<Void> store(SigningKeyRecord key) {
        return Uni.createFrom().item(() -> {
            keys.put(key.keyId(), key);
            LOG.debugv("Stored signing key: {0} (status: {1})", key.keyId(), key.status());
            return null;
        });
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findActive() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == KeyStatus.ACTIVE)
                .max(BY_ACTIVATION));
    }

    @Override
    public Uni<List<SigningKeyRecord>> findAllForVerification() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(SigningKeyRecord::canVerify)
                .toList());
    }

    @Override
    public Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status) {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == status)
                .toList());
    }

    @Override
    public Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime) {
        return Uni.createFrom().item(() -> {
            keys.compute(keyId, (id, existing) -> {
                if (existing == null) {
                    throw new IllegalArgumentException("Key not found: " + keyId);
                }
                return switch (newStatus) {
                    case ACTIVE -> existing;
                    case RETIRING -> existing.retire(transitionTime);
                    case REVOKED -> existing.revoke(transitionTime);
                };
            });
            LOG.debugv("Updated key {0} status to {1}", keyId, newStatus);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String keyId) {
        return Uni.createFrom().item(() -> {
            if (keys.remove(keyId) != null) {
                LOG.debugv("Deleted key: {0}", keyId);
            }
            return null;
        });
    }

    @Override
    public Uni<List<SigningKeyRecord>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }
}
