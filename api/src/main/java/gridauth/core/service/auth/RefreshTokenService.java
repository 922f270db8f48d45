package gridauth.core.service.auth;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.PilotConfig;
import gridauth.core.config.TokenConfig;
import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.exception.ReplayDetectedException;
import gridauth.core.exception.ServerFaultException;
import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.model.auth.RefreshTokenStatus;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.auth.TokenExtras;
import gridauth.core.port.in.RefreshTokenManagement;
import gridauth.core.port.out.AuthMetrics;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.core.util.SecureHash;

/**
 * Refresh grants, rotation and revocation.
 *
 * <h2>Rotation</h2>
 * A refresh marks the presented record ROTATED and stores a child with the same root.
 * Only the leaf of a chain is ACTIVE. Presenting a ROTATED record again means the token
 * leaked: the whole chain is revoked before the request fails.
 *
 * <p>The stored scope is resolved again on every refresh, so a property or membership
 * removed after issuance stops being granted at the next refresh.
 *
 * <p>Missing, expired and revoked tokens fail with the same message so callers cannot
 * tell them apart.
 */
@ApplicationScoped
public class RefreshTokenService implements RefreshTokenManagement {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);

    static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";

    private static final int MAX_REVOKE_ATTEMPTS = 3;
    private static final int MAX_SUBJECT_PASSES = 3;

    private final RefreshTokenRepository repository;
    private final TokenVerifier verifier;
    private final TokenIssuer issuer;
    private final ScopeResolver scopeResolver;
    private final AuthMetrics metrics;
    private final PilotConfig pilotConfig;
    private final TokenConfig tokenConfig;

    @Inject
    public RefreshTokenService(
            RefreshTokenRepository repository,
            TokenVerifier verifier,
            TokenIssuer issuer,
            ScopeResolver scopeResolver,
            AuthMetrics metrics,
            PilotConfig pilotConfig,
            TokenConfig tokenConfig) {
        this.repository = repository;
        this.verifier = verifier;
        this.issuer = issuer;
        this.scopeResolver = scopeResolver;
        this.metrics = metrics;
        this.pilotConfig = pilotConfig;
        this.tokenConfig = tokenConfig;
    }

    @Override
    public Uni<IssuedTokens> refresh(String rawRefreshToken) {
        return refresh(rawRefreshToken, null);
    }

    /**
     * Rotate a refresh token.
     *
     * @param rawRefreshToken signed refresh handle
     * @param pilotStamp      required for, and only accepted with, pilot refresh tokens
     */
    public Uni<IssuedTokens> refresh(String rawRefreshToken, String pilotStamp) {
        return Uni.createFrom().deferred(() -> {
            final var jti = handleJti(rawRefreshToken);
            return repository.findByJti(jti).<IssuedTokens>flatMap(found -> {
                final var now = Instant.now();
                final var record = found.filter(r -> !r.isExpired(now))
                        .orElseThrow(() -> new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN));

                switch (record.status()) {
                    case REVOKED:
                        throw new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN);
                    case ROTATED:
                        return replayDetected(record);
                    default:
                        break;
                }
                checkKind(record, pilotStamp);

                final var scope = reresolve(record);
                if (record.legacyExchange()) {
                    return Uni.createFrom().item(remintLegacy(record, scope));
                }
                return rotate(record, scope);
            });
        });
    }

    private void checkKind(RefreshTokenRecord record, String pilotStamp) {
        final var ok = switch (record.kind()) {
            case USER -> pilotStamp == null;
            case PILOT -> pilotStamp != null && pilotStamp.equals(record.pilotStamp());
            case JOB -> false;
        };
        if (!ok) {
            LOG.debugv("Refresh of {0} record {1} rejected", record.kind(), record.jti());
            throw new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN);
        }
    }

    private ResolvedScope reresolve(RefreshTokenRecord record) {
        if (record.kind() == CredentialKind.PILOT) {
            scopeResolver.requireVo(record.vo());
            return new ResolvedScope(record.vo(), null, List.of(pilotConfig.pilotCapability()));
        }
        final var subject = Identity.splitPrincipal(record.subject())[1];
        return scopeResolver.resolve(record.scope(), subject);
    }

    private Uni<IssuedTokens> rotate(RefreshTokenRecord record, ResolvedScope scope) {
        return repository
                .replace(record, record.withStatus(RefreshTokenStatus.ROTATED))
                .<IssuedTokens>flatMap(swapped -> {
                    if (!swapped) {
                        // Lost to a concurrent refresh of the same token.
                        return replayDetected(record);
                    }
                    final var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
                    final var child = new RefreshTokenRecord(
                            UUID.randomUUID().toString(),
                            record.kind(),
                            record.subject(),
                            record.vo(),
                            record.preferredUsername(),
                            scope.toScopeString(),
                            record.jti(),
                            record.rootJti(),
                            RefreshTokenStatus.ACTIVE,
                            now,
                            now.plus(issuer.refreshLifetime(record.kind())),
                            false,
                            record.pilotStamp(),
                            record.jobId());
                    return issuer.store(child)
                            .call(() -> ensureChainAlive(record, child))
                            .map(handle -> {
                                final var access = issuer.mint(
                                        identityOf(record, scope), scope, lifetimeClass(record), extrasOf(record));
                                metrics.recordTokensIssued(record.kind(), "refresh_token");
                                LOG.debugv("Rotated refresh token {0} to {1}", record.jti(), child.jti());
                                return new IssuedTokens(
                                        access.token(), access.expiresAt(), handle.token(), handle.expiresAt(), access.jti());
                            });
                });
    }

    /**
     * A replay detected between our CAS and the child insert revokes the chain by root,
     * possibly before the child existed. Revoke the child too in that case.
     */
    private Uni<Void> ensureChainAlive(RefreshTokenRecord parent, RefreshTokenRecord child) {
        return repository.findByJti(parent.jti()).<Void>flatMap(current -> {
            if (current.isPresent() && current.get().status() == RefreshTokenStatus.ROTATED) {
                return Uni.createFrom().voidItem();
            }
            LOG.warnv("Chain {0} was revoked during rotation, revoking {1}", parent.rootJti(), child.jti());
            return revokeRecord(child, 1)
                    .flatMap(ignored -> Uni.createFrom().failure(new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN)));
        });
    }

    private IssuedTokens remintLegacy(RefreshTokenRecord record, ResolvedScope scope) {
        final var access = issuer.mint(identityOf(record, scope), scope, LifetimeClass.USER, TokenExtras.legacy(null));
        metrics.recordTokensIssued(record.kind(), "refresh_token");
        return new IssuedTokens(access.token(), access.expiresAt(), null, null, access.jti());
    }

    private <T> Uni<T> replayDetected(RefreshTokenRecord record) {
        return revokeChain(record.rootJti()).flatMap(count -> {
            metrics.recordReplayDetected(count);
            LOG.warnv(
                    "Refresh token reuse detected for {0}: revoked {1} tokens of chain {2}",
                    SecureHash.truncatedSha256(record.subject(), 12), count, record.rootJti());
            return Uni.createFrom().failure(new ReplayDetectedException(record.rootJti(), count));
        });
    }

    @Override
    public Uni<Void> revoke(String rawRefreshToken) {
        final String jti;
        try {
            jti = handleJti(rawRefreshToken);
        } catch (ExpiredOrConsumedException e) {
            LOG.debug("Ignoring revocation of an invalid refresh token");
            return Uni.createFrom().voidItem();
        }
        return repository.findByJti(jti).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            return revokeChain(found.get().rootJti())
                    .invoke(count -> LOG.infov(
                            "Revoked refresh token chain {0} ({1} tokens)", found.get().rootJti(), count))
                    .replaceWithVoid();
        });
    }

    @Override
    public Uni<Integer> revokeAllForSubject(String principal) {
        return revokeSubjectPass(principal, 1, 0).invoke(total -> LOG.warnv(
                "Revoked all refresh tokens of {0} ({1} tokens)", SecureHash.truncatedSha256(principal, 12), total));
    }

    /**
     * A refresh racing with the revocation can insert a child after a pass read the index,
     * so passes repeat while they still find something to revoke.
     */
    private Uni<Integer> revokeSubjectPass(String principal, int pass, int total) {
        return repository.findBySubject(principal).flatMap(records -> revokeAll(records)).flatMap(count -> {
            if (count == 0 || pass >= MAX_SUBJECT_PASSES) {
                return Uni.createFrom().item(total + count);
            }
            return revokeSubjectPass(principal, pass + 1, total + count);
        });
    }

    @Override
    public Uni<List<RefreshTokenRecord>> listRefreshTokens(String principal) {
        final var now = Instant.now();
        return repository.findBySubject(principal).map(records -> records.stream()
                .filter(r -> r.isUsable(now))
                .toList());
    }

    @Override
    public Uni<Void> revokeRefreshTokenById(String principal, String jti) {
        return repository.findByJti(jti).flatMap(found -> {
            final var record = found.orElseThrow(() -> new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN));
            if (!record.subject().equals(principal)) {
                throw new PermissionDeniedException("Refresh token does not belong to the caller");
            }
            return revokeChain(record.rootJti()).replaceWithVoid();
        });
    }

    /**
     * Revoke every record of a rotation chain.
     *
     * @return Uni with the number of records this call moved to REVOKED
     */
    public Uni<Integer> revokeChain(String rootJti) {
        return repository.findByRoot(rootJti).flatMap(this::revokeAll);
    }

    /**
     * Revoke the given records, skipping those already revoked.
     */
    public Uni<Integer> revokeAll(List<RefreshTokenRecord> records) {
        final var pending = records.stream()
                .filter(r -> r.status() != RefreshTokenStatus.REVOKED)
                .toList();
        if (pending.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        return Multi.createFrom()
                .iterable(pending)
                .onItem()
                .transformToUniAndConcatenate(r -> revokeRecord(r, 1))
                .collect()
                .asList()
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    private Uni<Boolean> revokeRecord(RefreshTokenRecord record, int attempt) {
        return repository.replace(record, record.withStatus(RefreshTokenStatus.REVOKED)).<Boolean>flatMap(swapped -> {
            if (swapped) {
                return Uni.createFrom().item(true);
            }
            return repository.findByJti(record.jti()).<Boolean>flatMap(current -> {
                if (current.isEmpty() || current.get().status() == RefreshTokenStatus.REVOKED) {
                    return Uni.createFrom().item(false);
                }
                if (attempt >= MAX_REVOKE_ATTEMPTS) {
                    return Uni.createFrom()
                            .failure(new ServerFaultException("Could not revoke refresh token " + record.jti()));
                }
                return revokeRecord(current.get(), attempt + 1);
            });
        });
    }

    @Override
    public Uni<Integer> purgeExpired() {
        return repository.purgeExpired(Instant.now());
    }

    @Scheduled(
            every = "${gridauth.auth.tokens.cleanup-interval:PT15M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledCleanup() {
        if (!tokenConfig.cleanupEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return purgeExpired()
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infov("Purged {0} expired refresh tokens", count);
                    }
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Refresh token cleanup failed", e))
                .onFailure()
                .recoverWithNull();
    }

    private String handleJti(String rawRefreshToken) {
        try {
            return verifier.verifyRefreshHandle(rawRefreshToken);
        } catch (InvalidTokenException e) {
            LOG.debugv("Refresh handle rejected: {0}", e.getMessage());
            throw new ExpiredOrConsumedException(INVALID_REFRESH_TOKEN);
        }
    }

    private static Identity identityOf(RefreshTokenRecord record, ResolvedScope scope) {
        final var parts = Identity.splitPrincipal(record.subject());
        return new Identity(parts[1], parts[0], scope.group(), record.preferredUsername());
    }

    private static LifetimeClass lifetimeClass(RefreshTokenRecord record) {
        return record.kind() == CredentialKind.PILOT ? LifetimeClass.PILOT : LifetimeClass.USER;
    }

    private static TokenExtras extrasOf(RefreshTokenRecord record) {
        return record.kind() == CredentialKind.PILOT ? TokenExtras.pilot(record.pilotStamp()) : TokenExtras.NONE;
    }
}
