package gridauth.core.service.auth;

import java.security.interfaces.RSAPrivateKey;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.KeyRotationConfig;
import gridauth.core.config.LegacyExchangeConfig;
import gridauth.core.config.PilotConfig;
import gridauth.core.config.TokenConfig;
import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.SigningKeyRecord;
import gridauth.core.port.in.KeyManagement;
import gridauth.spi.SigningKeyRepository;

/**
 * Service for managing signing key rotation.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>A rotation makes a new key ACTIVE and moves the previous one to RETIRING</li>
 *   <li>Once the retirement window has elapsed, RETIRING keys become REVOKED</li>
 *   <li>After the retention period, REVOKED keys are deleted</li>
 * </ol>
 *
 * <p>The retirement window is the longest lifetime of any token the key can have
 * signed plus the clock skew, so no token that is still valid ever loses its key.
 */
@ApplicationScoped
public class KeyRotationService implements KeyManagement {

    private static final Logger LOG = Logger.getLogger(KeyRotationService.class);

    private final SigningKeyRegistry registry;
    private final SigningKeyRepository repository;
    private final KeyRotationConfig config;
    private final Duration retirementWindow;

    @Inject
    public KeyRotationService(
            SigningKeyRegistry registry,
            SigningKeyRepository repository,
            KeyRotationConfig config,
            TokenConfig tokenConfig,
            PilotConfig pilotConfig,
            LegacyExchangeConfig legacyConfig) {
        this.registry = registry;
        this.repository = repository;
        this.config = config;
        this.retirementWindow = Stream.of(
                        tokenConfig.accessTokenLifetime(),
                        tokenConfig.refreshTokenLifetime(),
                        pilotConfig.pilotTokenLifetime(),
                        pilotConfig.pilotRefreshTokenLifetime(),
                        pilotConfig.jobTokenLifetime(),
                        legacyConfig.maxTokenLifetime())
                .max(Duration::compareTo)
                .orElseThrow()
                .plus(tokenConfig.clockSkew());
    }

    /**
     * Time a key spends in RETIRING before it is revoked.
     */
    public Duration retirementWindow() {
        return retirementWindow;
    }

    @Override
    public Uni<SigningKeyRecord> rotateKeys() {
        LOG.info("Rotating signing keys with a generated key");
        return registry.rotate().map(SigningKeyRecord::withoutPrivateKey);
    }

    @Override
    public Uni<SigningKeyRecord> rotateKeys(String keyId, RSAPrivateKey privateKey) {
        LOG.infov("Rotating signing keys to supplied key {0}", keyId);
        return Uni.createFrom()
                .item(() -> SigningKeyRecord.active(
                        keyId, privateKey, SigningKeyRecord.derivePublicKey(privateKey), Instant.now()))
                .flatMap(registry::rotate)
                .map(SigningKeyRecord::withoutPrivateKey);
    }

    @Scheduled(
            cron = "${gridauth.auth.keys.rotation-schedule:0 0 0 1 * ?}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledRotation() {
        if (!config.schedulingEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return rotateKeys()
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Scheduled key rotation failed", e))
                .onFailure()
                .recoverWithNull();
    }

    @Override
    public Uni<Void> processKeyLifecycle() {
        LOG.debug("Processing key lifecycle transitions...");
        final var now = Instant.now();
        return revokeExpiredRetiringKeys(now)
                .flatMap(v -> deleteRevokedKeys(now))
                .onFailure()
                .invoke(e -> LOG.error("Key lifecycle processing failed", e));
    }

    @Scheduled(
            every = "${gridauth.auth.keys.lifecycle-interval:PT5M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledLifecycle() {
        if (!config.schedulingEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return processKeyLifecycle().onFailure().recoverWithNull();
    }

    private Uni<Void> revokeExpiredRetiringKeys(Instant now) {
        return repository.findByStatus(KeyStatus.RETIRING).flatMap(retiring -> {
            final var cutoff = now.minus(retirementWindow);
            final var toRevoke = retiring.stream()
                    .filter(key -> key.retiringAt() != null && !key.retiringAt().isAfter(cutoff))
                    .toList();

            if (toRevoke.isEmpty()) {
                return Uni.createFrom().voidItem();
            }

            LOG.infov("Revoking {0} retiring keys past the retirement window", toRevoke.size());
            return Uni.join()
                    .all(toRevoke.stream()
                            .map(key -> repository.updateStatus(key.keyId(), KeyStatus.REVOKED, now))
                            .toList())
                    .andFailFast()
                    .flatMap(v -> registry.refresh())
                    .replaceWithVoid();
        });
    }

    private Uni<Void> deleteRevokedKeys(Instant now) {
        return repository.findByStatus(KeyStatus.REVOKED).flatMap(revoked -> {
            final var cutoff = now.minus(config.retentionPeriod());
            final var toDelete = revoked.stream()
                    .filter(key -> key.revokedAt() != null && key.revokedAt().isBefore(cutoff))
                    .toList();

            if (toDelete.isEmpty()) {
                return Uni.createFrom().voidItem();
            }

            LOG.infov("Deleting {0} revoked keys past retention period", toDelete.size());
            return Uni.join()
                    .all(toDelete.stream()
                            .map(key -> repository
                                    .delete(key.keyId())
                                    .invoke(() -> LOG.infov("Deleted revoked key: {0}", key.keyId())))
                            .toList())
                    .andFailFast()
                    .replaceWithVoid();
        });
    }

    @Override
    public Uni<List<SigningKeyRecord>> listKeys() {
        return repository.findAll().map(keys -> keys.stream()
                .map(SigningKeyRecord::withoutPrivateKey)
                .toList());
    }

    @Override
    public Uni<SigningKeyRecord> getKey(String keyId) {
        return repository
                .findById(keyId)
                .map(opt -> opt.map(SigningKeyRecord::withoutPrivateKey)
                        .orElseThrow(() -> new KeyNotFoundException("Key not found: " + keyId)));
    }

    /**
     * Revoke a key right away, for example after a compromise.
     *
     * <p>Revoking the active key first rotates to a generated key so the service keeps
     * a signing key. Every token signed with the revoked key stops verifying.
     */
    @Override
    public Uni<Void> forceRevoke(String keyId) {
        return getKey(keyId).flatMap(key -> {
            if (key.status() == KeyStatus.REVOKED) {
                return Uni.createFrom().voidItem();
            }
            final var isActive = registry.snapshot()
                    .signingKey()
                    .map(active -> active.keyId().equals(keyId))
                    .orElse(false);
            final Uni<?> prepare = isActive ? registry.rotate() : Uni.createFrom().voidItem();
            return prepare.flatMap(ignored -> registry.revoke(keyId));
        });
    }

    /**
     * Exception thrown when a key is not found.
     */
    public static class KeyNotFoundException extends RuntimeException {
        public KeyNotFoundException(String message) {
            super(message);
        }
    }
}
