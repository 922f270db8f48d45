package gridauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for pilot credentials and job credentials.
 *
 * <p>Configuration prefix: {@code gridauth.auth.pilots}
 */
@ConfigMapping(prefix = "gridauth.auth.pilots")
public interface PilotConfig {

    /**
     * Lifetime of pilot access tokens.
     */
    @WithName("pilot-token-lifetime")
    @WithDefault("PT20M")
    Duration pilotTokenLifetime();

    /**
     * Lifetime of pilot refresh tokens.
     */
    @WithName("pilot-refresh-token-lifetime")
    @WithDefault("PT6H")
    Duration pilotRefreshTokenLifetime();

    /**
     * Lifetime of a job credential.
     */
    @WithName("job-token-lifetime")
    @WithDefault("PT1H")
    Duration jobTokenLifetime();

    /**
     * Capability required by pilots to match jobs.
     */
    @WithName("pilot-capability")
    @WithDefault("GenericPilot")
    String pilotCapability();

    /**
     * The single capability embedded in job credentials.
     */
    @WithName("job-capability")
    @WithDefault("JobExecution")
    String jobCapability();

    /**
     * Default lifetime of newly issued pilot secrets.
     */
    @WithName("secret-lifetime")
    @WithDefault("P1D")
    Duration secretLifetime();

    /**
     * Whether expired secrets and credentials are purged by the scheduler.
     */
    @WithName("cleanup-enabled")
    @WithDefault("false")
    boolean cleanupEnabled();

    /**
     * Interval of the purge job.
     */
    @WithName("cleanup-interval")
    @WithDefault("PT15M")
    Duration cleanupInterval();
}
