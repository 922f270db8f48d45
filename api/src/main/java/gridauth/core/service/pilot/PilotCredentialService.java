package gridauth.core.service.pilot;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.PilotConfig;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.model.auth.RefreshTokenStatus;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.auth.TokenExtras;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.model.pilot.JobAssignment;
import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.JobOutcome;
import gridauth.core.model.pilot.MatchedJob;
import gridauth.core.model.pilot.PilotLogin;
import gridauth.core.port.in.PilotCredentialUseCase;
import gridauth.core.port.out.AuthMetrics;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.core.service.auth.RefreshTokenService;
import gridauth.core.service.auth.TokenIssuer;
import gridauth.core.service.auth.TokenVerifier;
import gridauth.spi.JobMatcher;

/**
 * Pilot credential pipeline.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>A pilot secret is exchanged for a pilot credential: an access token carrying only
 *       the pilot capability plus a PILOT refresh token</li>
 *   <li>The pilot credential matches jobs. Each match yields a job credential bound to one
 *       job id and the job capability, backed by a JOB record</li>
 *   <li>Finalizing a job revokes its JOB records, so its credential stops authorizing. Only
 *       the pilot holding the job may finalize it</li>
 * </ol>
 *
 * <p>A pilot holds at most one live job credential: matching a new job supersedes the
 * previous one.
 */
@ApplicationScoped
public class PilotCredentialService implements PilotCredentialUseCase {

    private static final Logger LOG = Logger.getLogger(PilotCredentialService.class);

    private final PilotSecretService secrets;
    private final RefreshTokenService refreshTokens;
    private final RefreshTokenRepository repository;
    private final TokenIssuer issuer;
    private final TokenVerifier verifier;
    private final JobMatcher jobMatcher;
    private final AuthMetrics metrics;
    private final PilotConfig config;

    @Inject
    public PilotCredentialService(
            PilotSecretService secrets,
            RefreshTokenService refreshTokens,
            RefreshTokenRepository repository,
            TokenIssuer issuer,
            TokenVerifier verifier,
            JobMatcher jobMatcher,
            AuthMetrics metrics,
            PilotConfig config) {
        this.secrets = secrets;
        this.refreshTokens = refreshTokens;
        this.repository = repository;
        this.issuer = issuer;
        this.verifier = verifier;
        this.jobMatcher = jobMatcher;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<IssuedTokens> consumePilotSecret(PilotLogin login) {
        if (login.pilotStamp() == null || login.pilotStamp().isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("pilot_stamp is required"));
        }
        return secrets.consume(login).flatMap(secret -> {
            final var identity = new Identity(login.pilotStamp(), secret.vo(), null, null);
            final var scope = new ResolvedScope(secret.vo(), null, List.of(config.pilotCapability()));
            final var extras = TokenExtras.pilot(login.pilotStamp());
            return issuer.issue(identity, scope, LifetimeClass.PILOT, CredentialKind.PILOT, extras)
                    .invoke(tokens -> metrics.recordTokensIssued(CredentialKind.PILOT, "pilot_secret"));
        });
    }

    @Override
    public Uni<IssuedTokens> refreshPilotCredential(String rawRefreshToken, String pilotStamp) {
        if (pilotStamp == null || pilotStamp.isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("pilot_stamp is required"));
        }
        return refreshTokens.refresh(rawRefreshToken, pilotStamp);
    }

    @Override
    public Uni<Optional<JobAssignment>> matchJob(VerifiedToken pilot, JobMatchRequest request) {
        if (pilot.isJobCredential()
                || pilot.pilotStamp() == null
                || !pilot.hasProperty(config.pilotCapability())) {
            return Uni.createFrom()
                    .failure(new PermissionDeniedException("A pilot credential is required to match jobs"));
        }
        return jobMatcher
                .match(pilot.vo(), pilot.pilotStamp(), request)
                .<Optional<JobAssignment>>flatMap(matched -> {
            if (matched.isEmpty()) {
                LOG.debugv("No job matched for pilot {0}", pilot.pilotStamp());
                return Uni.createFrom().item(Optional.<JobAssignment>empty());
            }
            final var job = matched.get();
            return supersedeJobCredentials(pilot.pilotStamp())
                    .flatMap(superseded -> issueJobCredential(pilot, job))
                    .map(tokens -> Optional.of(new JobAssignment(job, tokens)));
        });
    }

    private Uni<Integer> supersedeJobCredentials(String pilotStamp) {
        return repository.findByPilotStamp(pilotStamp).flatMap(records -> refreshTokens
                .revokeAll(records.stream()
                        .filter(r -> r.kind() == CredentialKind.JOB)
                        .toList())
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infov("Superseded {0} job credentials of pilot {1}", count, pilotStamp);
                    }
                }));
    }

    private Uni<IssuedTokens> issueJobCredential(VerifiedToken pilot, MatchedJob job) {
        final var identity = job.owner() != null
                ? new Identity(job.owner(), job.vo(), job.group(), null)
                : new Identity(pilot.pilotStamp(), job.vo(), null, null);
        final var scope = new ResolvedScope(job.vo(), job.group(), List.of(config.jobCapability()));
        final var access =
                issuer.mint(identity, scope, LifetimeClass.JOB, TokenExtras.job(pilot.pilotStamp(), job.jobId()));

        final var backing = new RefreshTokenRecord(
                access.jti(),
                CredentialKind.JOB,
                identity.principal(),
                job.vo(),
                null,
                scope.toScopeString(),
                null,
                access.jti(),
                RefreshTokenStatus.ACTIVE,
                Instant.now().truncatedTo(ChronoUnit.SECONDS),
                access.expiresAt(),
                false,
                pilot.pilotStamp(),
                job.jobId());
        return repository.insert(backing).map(v -> {
            metrics.recordTokensIssued(CredentialKind.JOB, "job_match");
            LOG.infov("Pilot {0} matched job {1}", pilot.pilotStamp(), job.jobId());
            return new IssuedTokens(access.token(), access.expiresAt(), null, null, access.jti());
        });
    }

    @Override
    public Uni<Void> finalizeJob(VerifiedToken caller, String jobId, JobOutcome outcome) {
        if (caller.pilotStamp() == null) {
            return Uni.createFrom()
                    .failure(new PermissionDeniedException("A pilot or job credential is required to finalize a job"));
        }
        return repository.findByJobId(jobId).flatMap(records -> {
            final var jobRecords = records.stream()
                    .filter(r -> r.kind() == CredentialKind.JOB)
                    .toList();
            final var foreign = jobRecords.stream()
                    .filter(r -> r.status() == RefreshTokenStatus.ACTIVE)
                    .anyMatch(r -> !ownedBy(r, caller));
            if (foreign) {
                LOG.warnv("Pilot {0} tried to finalize job {1} held by another pilot", caller.pilotStamp(), jobId);
                return Uni.createFrom()
                        .<Integer>failure(new PermissionDeniedException("Job " + jobId + " is not held by this pilot"));
            }
            return refreshTokens.revokeAll(jobRecords.stream()
                    .filter(r -> ownedBy(r, caller))
                    .toList());
        })
                .invoke(count -> LOG.infov(
                        "Finalized job {0} ({1}): revoked {2} job credentials", jobId, outcome, count))
                .replaceWithVoid();
    }

    private static boolean ownedBy(RefreshTokenRecord record, VerifiedToken caller) {
        return caller.pilotStamp().equals(record.pilotStamp()) && caller.vo().equals(record.vo());
    }

    @Override
    public Uni<VerifiedToken> authorizeJobCredential(String rawToken, String jobId) {
        return Uni.createFrom().<VerifiedToken>deferred(() -> {
            final var token = verifier.verify(rawToken);
            if (!token.isJobCredential() || !token.jobId().equals(jobId)) {
                return Uni.createFrom().failure(new PermissionDeniedException("Token is not valid for job " + jobId));
            }
            return checkJobCredential(token);
        });
    }

    /**
     * Check that the JOB record backing a verified job credential is still active.
     *
     * @throws InvalidTokenException (as a failed Uni) once the job has been finalized
     */
    public Uni<VerifiedToken> checkJobCredential(VerifiedToken token) {
        return repository.findByJti(token.jti()).map(found -> {
            final var live = found.filter(r -> r.kind() == CredentialKind.JOB)
                    .filter(r -> r.status() == RefreshTokenStatus.ACTIVE)
                    .filter(r -> token.jobId().equals(r.jobId()))
                    .isPresent();
            if (!live) {
                throw new InvalidTokenException("Job credential has been revoked");
            }
            return token;
        });
    }
}
