package gridauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for signing key management and rotation.
 *
 * <p>Example configuration:
 * <pre>{@code
 * gridauth.auth.keys.generate-on-startup=true
 * gridauth.auth.keys.key-size=2048
 * gridauth.auth.keys.retention-period=P7D
 * gridauth.auth.keys.scheduling-enabled=true
 * gridauth.auth.keys.rotation-schedule=0 0 0 1 * ?
 * }</pre>
 */
@ConfigMapping(prefix = "gridauth.auth.keys")
public interface KeyRotationConfig {

    /**
     * Generate and activate a fresh key when the repository holds no active key at startup.
     *
     * <p>When false, startup fails if no active key can be found.
     */
    @WithName("generate-on-startup")
    @WithDefault("true")
    boolean generateOnStartup();

    /**
     * RSA key size in bits.
     */
    @WithName("key-size")
    @WithDefault("2048")
    int keySize();

    /**
     * How long revoked keys are kept (for audit) before they are deleted.
     */
    @WithName("retention-period")
    @WithDefault("P7D")
    Duration retentionPeriod();

    /**
     * Whether the scheduled rotation and lifecycle jobs run.
     *
     * <p>Rotation and lifecycle processing are always available through the
     * admin API; this only controls the in-process scheduler.
     */
    @WithName("scheduling-enabled")
    @WithDefault("false")
    boolean schedulingEnabled();

    /**
     * Cron schedule for automatic key rotation (Quartz syntax).
     */
    @WithName("rotation-schedule")
    @WithDefault("0 0 0 1 * ?")
    String rotationSchedule();

    /**
     * Interval of the key lifecycle job (retiring to revoked, revoked cleanup).
     */
    @WithName("lifecycle-interval")
    @WithDefault("PT5M")
    Duration lifecycleInterval();

    /**
     * Interval at which the in-memory key snapshot is reloaded from the repository.
     */
    @WithName("cache-refresh-interval")
    @WithDefault("PT5M")
    Duration cacheRefreshInterval();

    /**
     * Optional PEM-encoded PKCS#8 RSA private key loaded as the initial active key.
     */
    @WithName("bootstrap-key")
    Optional<String> bootstrapKey();

    /**
     * Key id used for the bootstrap key.
     */
    @WithName("bootstrap-key-id")
    @WithDefault("bootstrap")
    String bootstrapKeyId();
}
