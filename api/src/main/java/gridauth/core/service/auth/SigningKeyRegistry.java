package gridauth.core.service.auth;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.time.MonthDay;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.KeyRotationConfig;
import gridauth.core.exception.SigningKeyUnavailableException;
import gridauth.core.model.auth.KeySetSnapshot;
import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.SigningKeyRecord;
import gridauth.spi.SigningKeyRepository;

/**
 * Registry holding the current signing key set.
 *
 * <p>Token signing and verification read a single {@link KeySetSnapshot} from a
 * volatile field, so the hot path never touches the repository. Every change to the
 * key set (startup, rotation, lifecycle transitions, periodic refresh) rebuilds the
 * snapshot from the repository and swaps it in as a whole.
 *
 * <h2>Thread Safety</h2>
 * Readers are lock-free. Rotations are serialized; a rotation requested while
 * another one is running fails with {@link IllegalStateException}.
 */
@ApplicationScoped
public class SigningKeyRegistry {

    private static final Logger LOG = Logger.getLogger(SigningKeyRegistry.class);

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final SigningKeyRepository repository;
    private final KeyRotationConfig config;
    private final AtomicLong versions = new AtomicLong();
    private final AtomicBoolean rotating = new AtomicBoolean();

    private volatile KeySetSnapshot snapshot = KeySetSnapshot.empty();

    @Inject
    public SigningKeyRegistry(SigningKeyRepository repository, KeyRotationConfig config) {
        this.repository = repository;
        this.config = config;
    }

    /**
     * Make sure an active key exists before the application serves requests.
     *
     * <p>Throwing from this observer aborts startup.
     */
    void init(@Observes StartupEvent event) {
        LOG.info("Initializing signing key registry...");
        initialize().await().atMost(STARTUP_TIMEOUT);
        LOG.infov("Signing key registry initialized with active key {0}", currentSigningKey().keyId());
    }

    /**
     * Load the key set and generate a first key if none is active and generation is enabled.
     *
     * @return Uni completing once a signing key is available
     * @throws SigningKeyUnavailableException (as a failed Uni) when no key is active and
     *         generation on startup is disabled
     */
    public Uni<Void> initialize() {
        return refresh().flatMap(current -> {
            if (current.signingKey().isPresent()) {
                return Uni.createFrom().voidItem();
            }
            if (!config.generateOnStartup()) {
                return Uni.createFrom()
                        .failure(new SigningKeyUnavailableException(
                                "No active signing key and gridauth.auth.keys.generate-on-startup is false"));
            }
            LOG.info("No active signing key found, generating one");
            return generateKey().flatMap(this::activate).replaceWithVoid();
        });
    }

    /**
     * The snapshot in use right now. Hold on to the returned value for the duration of
     * one operation.
     */
    public KeySetSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Get the key used for new signatures.
     *
     * @throws SigningKeyUnavailableException if no active key is loaded
     */
    public SigningKeyRecord currentSigningKey() {
        return snapshot.signingKey()
                .orElseThrow(() -> new SigningKeyUnavailableException("No active signing key loaded"));
    }

    /**
     * Get a key accepted for verification (ACTIVE or RETIRING).
     */
    public Optional<SigningKeyRecord> verificationKey(String keyId) {
        return snapshot.verificationKey(keyId);
    }

    /**
     * Public halves of every key accepted for verification, as published in the JWKS.
     */
    public List<SigningKeyRecord> publicKeys() {
        return snapshot.publicKeys();
    }

    public boolean isReady() {
        return snapshot.signingKey().isPresent();
    }

    /**
     * Generate an RSA key of the configured size and make it the active key.
     */
    public Uni<SigningKeyRecord> rotate() {
        return generateKey().flatMap(this::rotate);
    }

    /**
     * Make {@code newKey} the active key. The previous active key moves to RETIRING
     * and stays valid for verification.
     *
     * @param newKey an ACTIVE key with private material
     * @return Uni with the new active key
     */
    public Uni<SigningKeyRecord> rotate(SigningKeyRecord newKey) {
        if (!newKey.canSign()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Rotation needs an ACTIVE key with a private key"));
        }
        if (!rotating.compareAndSet(false, true)) {
            return Uni.createFrom().failure(new IllegalStateException("Key rotation already in progress"));
        }

        final var previous = snapshot.signingKey();
        return activate(newKey)
                .call(() -> previous.filter(key -> !key.keyId().equals(newKey.keyId()))
                        .map(key -> retire(key.keyId()))
                        .orElse(Uni.createFrom().voidItem()))
                .call(this::refresh)
                .invoke(key -> LOG.infov(
                        "Rotated signing key: {0} is active, {1} is retiring",
                        key.keyId(), previous.map(SigningKeyRecord::keyId).orElse("none")))
                .eventually(() -> rotating.set(false));
    }

    /**
     * Move a key to RETIRING. It no longer signs but still verifies.
     */
    public Uni<Void> retire(String keyId) {
        return repository
                .updateStatus(keyId, KeyStatus.RETIRING, Instant.now())
                .invoke(() -> LOG.infov("Key {0} retiring", keyId))
                .flatMap(v -> refresh())
                .replaceWithVoid();
    }

    /**
     * Move a key to REVOKED. Tokens signed with it stop verifying immediately.
     */
    public Uni<Void> revoke(String keyId) {
        LOG.warnv("Revoking key: {0} - tokens signed with this key will no longer verify", keyId);
        return repository
                .updateStatus(keyId, KeyStatus.REVOKED, Instant.now())
                .flatMap(v -> refresh())
                .replaceWithVoid();
    }

    /**
     * Rebuild the snapshot from the repository and swap it in.
     *
     * <p>If loading fails the previous snapshot stays in use.
     */
    public Uni<KeySetSnapshot> refresh() {
        return Uni.combine()
                .all()
                .unis(repository.findActive(), repository.findAllForVerification())
                .asTuple()
                .map(tuple -> {
                    final var next = KeySetSnapshot.of(
                            versions.incrementAndGet(), tuple.getItem1().orElse(null), tuple.getItem2(), Instant.now());
                    this.snapshot = next;
                    LOG.debugv(
                            "Key snapshot {0}: active key {1}, {2} verification keys",
                            next.version(),
                            next.signingKey().map(SigningKeyRecord::keyId).orElse("none"),
                            next.verificationKeys().size());
                    return next;
                })
                .onFailure()
                .invoke(e -> LOG.error("Failed to refresh signing key snapshot", e));
    }

    @Scheduled(
            every = "${gridauth.auth.keys.cache-refresh-interval:PT5M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledRefresh() {
        return refresh().replaceWithVoid();
    }

    /**
     * Generate (but do not store) a fresh ACTIVE key.
     */
    public Uni<SigningKeyRecord> generateKey() {
        return Uni.createFrom().item(() -> {
            try {
                final var keyPair = generateKeyPair();
                return SigningKeyRecord.active(
                        generateKeyId(),
                        (RSAPrivateKey) keyPair.getPrivate(),
                        (RSAPublicKey) keyPair.getPublic(),
                        Instant.now());
            } catch (NoSuchAlgorithmException e) {
                throw new SigningKeyUnavailableException("RSA key generation unavailable: " + e.getMessage());
            }
        });
    }

    private Uni<SigningKeyRecord> activate(SigningKeyRecord key) {
        return repository
                .store(key)
                .flatMap(v -> refresh())
                .replaceWith(key)
                .invoke(stored -> LOG.infov("Activated signing key: {0}", stored.keyId()));
    }

    /**
     * Format: k-{year}-q{quarter}-{short-uuid}, e.g. k-2024-q1-a1b2c3d4.
     */
    private String generateKeyId() {
        final var now = Instant.now().atZone(ZoneOffset.UTC);
        final var quarter = (MonthDay.from(now).getMonthValue() - 1) / 3 + 1;
        final var shortUuid = UUID.randomUUID().toString().substring(0, 8);
        return String.format("k-%d-q%d-%s", Year.from(now).getValue(), quarter, shortUuid);
    }

    private KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        final var keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(config.keySize());
        return keyGen.generateKeyPair();
    }
}
