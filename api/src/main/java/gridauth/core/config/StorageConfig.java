package gridauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the flow, refresh token and pilot secret stores.
 *
 * <p>Configuration prefix: {@code gridauth.storage}
 */
@ConfigMapping(prefix = "gridauth.storage")
public interface StorageConfig {

    /**
     * Storage provider name: {@code memory}, {@code redis}, or a custom SPI name.
     */
    @WithDefault("memory")
    String provider();

    /**
     * Redis-specific configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Prefix of every key written by the Redis stores.
         */
        @WithName("key-prefix")
        @WithDefault("gridauth:")
        String keyPrefix();

        /**
         * Timeout applied to each Redis operation.
         */
        @WithDefault("PT2S")
        Duration timeout();
    }
}
