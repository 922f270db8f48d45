package gridauth.core.service.auth;

import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.LegacyExchangeConfig;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.ServiceDisabledException;
import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.TokenExtras;
import gridauth.core.port.in.LegacyExchangeUseCase;
import gridauth.core.port.out.AuthMetrics;
import gridauth.core.util.SecureHash;

/**
 * Token minting for the legacy system's service processes.
 *
 * <p>The caller presents {@code Authorization: Bearer diracx:legacy:<base64url key>}. Only
 * the SHA-256 hex of the key is configured, and it is compared in constant time.
 *
 * <h2>Configuration</h2>
 * <pre>
 * gridauth.auth.legacy.hashed-api-key=${LEGACY_EXCHANGE_HASHED_KEY}
 * </pre>
 */
@ApplicationScoped
public class LegacyExchangeService implements LegacyExchangeUseCase {

    private static final Logger LOG = Logger.getLogger(LegacyExchangeService.class);

    static final String HEADER_PREFIX = "Bearer diracx:legacy:";

    private final ScopeResolver scopeResolver;
    private final TokenIssuer issuer;
    private final AuthMetrics metrics;
    private final LegacyExchangeConfig config;

    @Inject
    public LegacyExchangeService(
            ScopeResolver scopeResolver, TokenIssuer issuer, AuthMetrics metrics, LegacyExchangeConfig config) {
        this.scopeResolver = scopeResolver;
        this.issuer = issuer;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public boolean isEnabled() {
        return config.hashedApiKey().filter(k -> !k.isBlank()).isPresent();
    }

    @Override
    public Uni<IssuedTokens> exchange(
            String authorization, String preferredUsername, String scope, Optional<Integer> expiresMinutes) {
        return Uni.createFrom().deferred(() -> {
            if (!isEnabled()) {
                throw new ServiceDisabledException("Legacy exchange is not enabled");
            }
            authenticate(authorization);

            if (preferredUsername == null || preferredUsername.isBlank()) {
                throw new InvalidRequestException("preferred_username is required");
            }
            final var requested = scopeResolver.resolve(scope);
            final var subject = scopeResolver
                    .requireVo(requested.vo())
                    .subjectFor(preferredUsername)
                    .orElseThrow(() -> new InvalidRequestException(
                            "User " + preferredUsername + " is not registered in VO " + requested.vo()));
            final var resolved = scopeResolver.resolve(scope, subject);
            final var identity = new Identity(subject, resolved.vo(), resolved.group(), preferredUsername);

            return issuer.issue(
                            identity,
                            resolved,
                            LifetimeClass.USER,
                            CredentialKind.USER,
                            TokenExtras.legacy(lifetime(expiresMinutes)))
                    .invoke(tokens -> {
                        metrics.recordTokensIssued(CredentialKind.USER, "legacy_exchange");
                        LOG.infov(
                                "Legacy exchange issued tokens for {0}",
                                SecureHash.truncatedSha256(identity.principal(), 12));
                    });
        });
    }

    private void authenticate(String authorization) {
        if (authorization == null || !authorization.startsWith(HEADER_PREFIX)) {
            throw new InvalidRequestException("Invalid authorization header");
        }
        final byte[] key;
        try {
            key = Base64.getUrlDecoder().decode(authorization.substring(HEADER_PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid authorization header", e);
        }
        final var expected = config.hashedApiKey().orElseThrow().trim().toLowerCase();
        if (!SecureHash.digestsEqual(SecureHash.sha256Hex(key), expected)) {
            LOG.warn("Legacy exchange rejected an invalid API key");
            throw new InvalidTokenException("Invalid legacy exchange credentials");
        }
    }

    private Duration lifetime(Optional<Integer> expiresMinutes) {
        if (expiresMinutes.isEmpty()) {
            return null;
        }
        final int minutes = expiresMinutes.get();
        if (minutes <= 0) {
            throw new InvalidRequestException("expires_minutes must be positive");
        }
        final var requested = Duration.ofMinutes(minutes);
        return requested.compareTo(config.maxTokenLifetime()) > 0 ? config.maxTokenLifetime() : requested;
    }
}
