package gridauth.core.service.pilot;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.PilotConfig;
import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.ServerFaultException;
import gridauth.core.model.pilot.IssuedPilotSecret;
import gridauth.core.model.pilot.PilotLogin;
import gridauth.core.model.pilot.PilotSecretRecord;
import gridauth.core.model.pilot.PilotSecretRequest;
import gridauth.core.port.in.PilotSecretManagement;
import gridauth.core.port.out.AuthMetrics;
import gridauth.core.port.out.PilotSecretRepository;
import gridauth.core.service.auth.ScopeResolver;
import gridauth.core.util.SecureHash;
import gridauth.core.util.SecureTokens;

/**
 * Provisioning and consumption of pilot secrets.
 *
 * <p>Only SHA-256 hashes are stored. Consumption is a compare-and-swap on the use count,
 * or a conditional delete for the last use, so two pilots racing on a single-use secret
 * never both succeed.
 */
@ApplicationScoped
public class PilotSecretService implements PilotSecretManagement {

    private static final Logger LOG = Logger.getLogger(PilotSecretService.class);

    static final String INVALID_PILOT_CREDENTIALS = "Invalid pilot credentials";

    private static final int SECRET_BYTES = 32;
    private static final int MAX_CONSUME_ATTEMPTS = 5;

    private final PilotSecretRepository repository;
    private final ScopeResolver scopeResolver;
    private final AuthMetrics metrics;
    private final PilotConfig config;

    @Inject
    public PilotSecretService(
            PilotSecretRepository repository, ScopeResolver scopeResolver, AuthMetrics metrics, PilotConfig config) {
        this.repository = repository;
        this.scopeResolver = scopeResolver;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<List<IssuedPilotSecret>> issueSecrets(PilotSecretRequest request) {
        return Uni.createFrom().deferred(() -> {
            scopeResolver.requireVo(request.vo());
            final var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
            final var expiresAt = now.plus(request.lifetime() != null ? request.lifetime() : config.secretLifetime());

            return Multi.createFrom()
                    .range(0, request.count())
                    .onItem()
                    .transformToUniAndConcatenate(i -> issueOne(request, now, expiresAt))
                    .collect()
                    .asList()
                    .invoke(secrets -> LOG.infov(
                            "Issued {0} pilot secrets for VO {1} (max uses {2})",
                            secrets.size(), request.vo(), request.maxUses()));
        });
    }

    private Uni<IssuedPilotSecret> issueOne(PilotSecretRequest request, Instant now, Instant expiresAt) {
        final var secret = SecureTokens.urlSafe(SECRET_BYTES);
        final var record = new PilotSecretRecord(
                SecureHash.sha256Hex(secret),
                request.vo(),
                request.pilotStamps(),
                request.sites(),
                request.maxUses(),
                0,
                now,
                expiresAt,
                null);
        return repository.insert(record).map(inserted -> {
            if (!inserted) {
                throw new ServerFaultException("Pilot secret hash collision");
            }
            return new IssuedPilotSecret(secret, request.vo(), request.maxUses(), expiresAt);
        });
    }

    /**
     * Use a pilot secret once.
     *
     * @return Uni with the record as it was before this use
     * @throws ExpiredOrConsumedException (as a failed Uni) when the secret is unknown,
     *         exhausted, expired or does not allow this pilot or site
     */
    public Uni<PilotSecretRecord> consume(PilotLogin login) {
        if (login.secret() == null || login.secret().isBlank()) {
            return Uni.createFrom().failure(invalid());
        }
        final var hash = SecureHash.sha256Hex(login.secret());
        return consume(hash, login, 1)
                .invoke(record -> {
                    metrics.recordPilotSecretConsumed(true);
                    LOG.infov(
                            "Pilot secret {0} consumed by pilot {1} ({2}/{3} uses)",
                            SecureHash.truncatedSha256(hash, 12), login.pilotStamp(),
                            record.useCount() + 1, record.maxUses());
                })
                .onFailure(ExpiredOrConsumedException.class)
                .invoke(e -> metrics.recordPilotSecretConsumed(false));
    }

    private Uni<PilotSecretRecord> consume(String hash, PilotLogin login, int attempt) {
        return repository.findByHash(hash).<PilotSecretRecord>flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().failure(invalid());
            }
            final var record = found.get();
            final var now = Instant.now();

            if (!record.allows(login.pilotStamp(), login.site())) {
                LOG.debugv(
                        "Pilot secret {0} does not allow pilot {1}",
                        SecureHash.truncatedSha256(hash, 12), login.pilotStamp());
                return Uni.createFrom().failure(invalid());
            }
            if (record.isExpired(now)) {
                return repository.remove(record).<PilotSecretRecord>flatMap(removed -> Uni.createFrom().failure(invalid()));
            }
            if (record.isExhausted()) {
                return Uni.createFrom().failure(invalid());
            }

            final var transition = record.isLastUse()
                    ? repository.remove(record)
                    : repository.replace(record, record.consumedAt(now));
            return transition.<PilotSecretRecord>flatMap(won -> {
                if (won) {
                    return Uni.createFrom().item(record);
                }
                if (attempt >= MAX_CONSUME_ATTEMPTS) {
                    LOG.warnv(
                            "Gave up consuming pilot secret {0} after {1} attempts",
                            SecureHash.truncatedSha256(hash, 12), attempt);
                    return Uni.createFrom().failure(invalid());
                }
                return consume(hash, login, attempt + 1);
            });
        });
    }

    @Override
    public Uni<Integer> purgeExpiredSecrets() {
        return repository.purgeExpired(Instant.now());
    }

    @Scheduled(
            every = "${gridauth.auth.pilots.cleanup-interval:PT15M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledCleanup() {
        if (!config.cleanupEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return purgeExpiredSecrets()
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infov("Purged {0} expired pilot secrets", count);
                    }
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Pilot secret cleanup failed", e))
                .onFailure()
                .recoverWithNull();
    }

    private static ExpiredOrConsumedException invalid() {
        return new ExpiredOrConsumedException(INVALID_PILOT_CREDENTIALS, ExpiredOrConsumedException.INVALID_CLIENT);
    }
}
