package gridauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for calls to external identity providers.
 *
 * <p>Configuration prefix: {@code gridauth.auth.idp}
 */
@ConfigMapping(prefix = "gridauth.auth.idp")
public interface IdpConfig {

    /**
     * Upper bound on every HTTP call to an IdP (metadata, JWKS, token endpoint).
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * How long fetched server metadata and key sets are cached.
     */
    @WithName("metadata-cache-ttl")
    @WithDefault("PT1H")
    Duration metadataCacheTtl();

    /**
     * Maximum number of IdPs whose metadata is cached.
     */
    @WithName("metadata-cache-size")
    @WithDefault("64")
    int metadataCacheSize();
}
