package gridauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the legacy system token exchange.
 *
 * <p>The exchange is disabled unless a hashed key is configured. The hash is the
 * hex SHA-256 of the raw key bytes:
 * <pre>{@code
 * gridauth.auth.legacy.hashed-api-key=5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8
 * }</pre>
 */
@ConfigMapping(prefix = "gridauth.auth.legacy")
public interface LegacyExchangeConfig {

    @WithName("hashed-api-key")
    Optional<String> hashedApiKey();

    /**
     * Upper bound of the {@code expires_minutes} lifetime override.
     */
    @WithName("max-token-lifetime")
    @WithDefault("PT60M")
    Duration maxTokenLifetime();
}
