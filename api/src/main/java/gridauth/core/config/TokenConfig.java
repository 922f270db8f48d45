package gridauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for minted access and refresh tokens.
 *
 * <p>Configuration prefix: {@code gridauth.auth.tokens}
 */
@ConfigMapping(prefix = "gridauth.auth.tokens")
public interface TokenConfig {

    /**
     * Value of the {@code iss} claim; also the advertised OpenID issuer.
     */
    @WithDefault("http://localhost:8080")
    String issuer();

    /**
     * Value of the {@code aud} claim of every token minted by this installation.
     */
    @WithDefault("gridauth")
    String audience();

    /**
     * Lifetime of user access tokens.
     */
    @WithName("access-token-lifetime")
    @WithDefault("PT20M")
    Duration accessTokenLifetime();

    /**
     * Lifetime of user refresh tokens.
     */
    @WithName("refresh-token-lifetime")
    @WithDefault("PT60M")
    Duration refreshTokenLifetime();

    /**
     * Allowed clock skew when verifying {@code exp} and {@code iat}.
     */
    @WithName("clock-skew")
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Whether expired refresh token records are purged periodically. Redis expires them
     * natively, so this matters for the in-memory store.
     */
    @WithName("cleanup-enabled")
    @WithDefault("true")
    boolean cleanupEnabled();

    @WithName("cleanup-interval")
    @WithDefault("PT15M")
    Duration cleanupInterval();
}
