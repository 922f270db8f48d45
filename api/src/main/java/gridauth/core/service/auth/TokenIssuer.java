package gridauth.core.service.auth;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import gridauth.core.config.PilotConfig;
import gridauth.core.config.TokenConfig;
import gridauth.core.exception.SigningKeyUnavailableException;
import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.model.auth.RefreshTokenStatus;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.auth.SignedToken;
import gridauth.core.model.auth.TokenClaims;
import gridauth.core.model.auth.TokenExtras;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.core.util.SecureHash;

/**
 * Mints RS256 access tokens and refresh tokens.
 *
 * <p>Access tokens are never stored. A refresh token is a persisted
 * {@link RefreshTokenRecord} plus a signed handle carrying only {@code jti},
 * {@code exp}, {@code iss}, {@code aud} and {@code typ=refresh}.
 *
 * <p>Every signature uses the active key of one registry snapshot and puts its
 * key id in the {@code kid} header.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final SigningKeyRegistry keyRegistry;
    private final RefreshTokenRepository refreshTokens;
    private final TokenConfig tokenConfig;
    private final PilotConfig pilotConfig;

    @Inject
    public TokenIssuer(
            SigningKeyRegistry keyRegistry,
            RefreshTokenRepository refreshTokens,
            TokenConfig tokenConfig,
            PilotConfig pilotConfig) {
        this.keyRegistry = keyRegistry;
        this.refreshTokens = refreshTokens;
        this.tokenConfig = tokenConfig;
        this.pilotConfig = pilotConfig;
    }

    /**
     * Mint an access token carrying exactly the resolved scope.
     */
    public SignedToken mint(Identity identity, ResolvedScope scope, LifetimeClass lifetimeClass) {
        return mint(identity, scope, lifetimeClass, TokenExtras.NONE);
    }

    public SignedToken mint(Identity identity, ResolvedScope scope, LifetimeClass lifetimeClass, TokenExtras extras) {
        final var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        final var lifetime = extras.lifetimeOverride() != null ? extras.lifetimeOverride() : lifetime(lifetimeClass);
        final var expiresAt = now.plus(lifetime);
        final var jti = UUID.randomUUID().toString();

        final var claims = baseClaims(jti, now, expiresAt, TokenClaims.TYPE_ACCESS);
        claims.setSubject(identity.principal());
        claims.setClaim(TokenClaims.VO, scope.vo());
        if (scope.group() != null) {
            claims.setClaim(TokenClaims.GROUP, scope.group());
        }
        claims.setStringListClaim(TokenClaims.PROPERTIES, scope.properties());
        if (identity.preferredUsername() != null) {
            claims.setClaim(TokenClaims.PREFERRED_USERNAME, identity.preferredUsername());
        }
        if (extras.pilotStamp() != null) {
            claims.setClaim(TokenClaims.PILOT_STAMP, extras.pilotStamp());
        }
        if (extras.jobId() != null) {
            claims.setClaim(TokenClaims.JOB_ID, extras.jobId());
        }
        if (extras.legacyExchange()) {
            claims.setClaim(TokenClaims.LEGACY_EXCHANGE, true);
        }

        final var token = sign(claims);
        LOG.debugv(
                "Minted {0} access token {1} for {2}",
                lifetimeClass, jti, SecureHash.truncatedSha256(identity.principal(), 12));
        return new SignedToken(token, jti, expiresAt);
    }

    /**
     * Create and persist a new refresh token chain root, and sign its handle.
     */
    public Uni<SignedToken> mintRefresh(Identity identity, ResolvedScope scope) {
        return mintRefresh(identity, scope, CredentialKind.USER, TokenExtras.NONE);
    }

    public Uni<SignedToken> mintRefresh(
            Identity identity, ResolvedScope scope, CredentialKind kind, TokenExtras extras) {
        final var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        final var jti = UUID.randomUUID().toString();
        final var record = new RefreshTokenRecord(
                jti,
                kind,
                identity.principal(),
                scope.vo(),
                identity.preferredUsername(),
                scope.toScopeString(),
                null,
                jti,
                RefreshTokenStatus.ACTIVE,
                now,
                now.plus(refreshLifetime(kind)),
                extras.legacyExchange(),
                extras.pilotStamp(),
                extras.jobId());
        return store(record);
    }

    /**
     * Persist a record and sign its handle.
     */
    public Uni<SignedToken> store(RefreshTokenRecord record) {
        return refreshTokens.insert(record).map(v -> signRefreshHandle(record));
    }

    /**
     * Mint an access token and a refresh token for a new session.
     */
    public Uni<IssuedTokens> issue(
            Identity identity,
            ResolvedScope scope,
            LifetimeClass lifetimeClass,
            CredentialKind refreshKind,
            TokenExtras extras) {
        final var access = mint(identity, scope, lifetimeClass, extras);
        return mintRefresh(identity, scope, refreshKind, extras)
                .map(refresh -> new IssuedTokens(
                        access.token(), access.expiresAt(), refresh.token(), refresh.expiresAt(), access.jti()));
    }

    /**
     * Sign the opaque handle of a stored refresh token record.
     */
    public SignedToken signRefreshHandle(RefreshTokenRecord record) {
        final var claims = baseClaims(record.jti(), Instant.now(), record.expiresAt(), TokenClaims.TYPE_REFRESH);
        return new SignedToken(sign(claims), record.jti(), record.expiresAt());
    }

    public Duration lifetime(LifetimeClass lifetimeClass) {
        return switch (lifetimeClass) {
            case USER -> tokenConfig.accessTokenLifetime();
            case PILOT -> pilotConfig.pilotTokenLifetime();
            case JOB -> pilotConfig.jobTokenLifetime();
        };
    }

    public Duration refreshLifetime(CredentialKind kind) {
        return switch (kind) {
            case USER -> tokenConfig.refreshTokenLifetime();
            case PILOT -> pilotConfig.pilotRefreshTokenLifetime();
            case JOB -> pilotConfig.jobTokenLifetime();
        };
    }

    private JwtClaims baseClaims(String jti, Instant issuedAt, Instant expiresAt, String type) {
        final var claims = new JwtClaims();
        claims.setIssuer(tokenConfig.issuer());
        claims.setAudience(tokenConfig.audience());
        claims.setJwtId(jti);
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        claims.setClaim(TokenClaims.TOKEN_TYPE, type);
        return claims;
    }

    private String sign(JwtClaims claims) {
        final var key = keyRegistry.currentSigningKey();
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key.privateKey());
        jws.setKeyIdHeaderValue(key.keyId());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new SigningKeyUnavailableException("Failed to sign token with key " + key.keyId() + ": " + e.getMessage());
        }
    }
}
