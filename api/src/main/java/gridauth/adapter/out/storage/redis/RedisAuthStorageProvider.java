package gridauth.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gridauth.core.config.StorageConfig;
import gridauth.core.port.out.AuthorizationFlowRepository;
import gridauth.core.port.out.DeviceFlowRepository;
import gridauth.core.port.out.PilotSecretRepository;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.spi.AuthStorageProvider;

/**
 * Redis-based storage provider, recommended for production and required for
 * more than one instance.
 *
 * <p>All records carry Redis TTLs matching their expiry, and every status
 * transition is a Lua compare-and-swap.
 */
@ApplicationScoped
public class RedisAuthStorageProvider implements AuthStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisAuthStorageProvider.class);
    private static final int PRIORITY = 100;

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final StorageConfig config;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);

    private volatile Repositories repositories;

    @Inject
    public RedisAuthStorageProvider(ReactiveRedisDataSource redisDataSource, StorageConfig config) {
        this.redisDataSource = redisDataSource;
        this.config = config;
    }

    @PostConstruct
    void checkAvailability() {
        if (!"redis".equals(config.provider())) {
            return;
        }
        redisDataSource
                .execute("PING")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            LOG.info("Redis auth storage is available");
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            LOG.errorf("Redis auth storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    /**
     * Available unless the startup check failed. Requests made while the check is
     * still running go to Redis and fail on their own if it is down.
     */
    @Override
    public boolean isAvailable() {
        return availabilityState.get() != AvailabilityState.UNAVAILABLE;
    }

    @Override
    public AuthorizationFlowRepository authorizationFlows() {
        return repositories().authorizationFlows();
    }

    @Override
    public DeviceFlowRepository deviceFlows() {
        return repositories().deviceFlows();
    }

    @Override
    public RefreshTokenRepository refreshTokens() {
        return repositories().refreshTokens();
    }

    @Override
    public PilotSecretRepository pilotSecrets() {
        return repositories().pilotSecrets();
    }

    private synchronized Repositories repositories() {
        if (repositories == null) {
            final var prefix = config.redis().keyPrefix();
            final var timeout = config.redis().timeout();
            repositories = new Repositories(
                    new RedisAuthorizationFlowRepository(
                            redisDataSource, prefix, new RedisTimeoutHelper(timeout, "authorization-flows")),
                    new RedisDeviceFlowRepository(
                            redisDataSource, prefix, new RedisTimeoutHelper(timeout, "device-flows")),
                    new RedisRefreshTokenRepository(
                            redisDataSource, prefix, new RedisTimeoutHelper(timeout, "refresh-tokens")),
                    new RedisPilotSecretRepository(
                            redisDataSource, prefix, new RedisTimeoutHelper(timeout, "pilot-secrets")));
            LOG.infov("Created Redis auth repositories with prefix: {0}", prefix);
        }
        return repositories;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("auth-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", config.redis().keyPrefix())
                    .build());
        }
        final var error = state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("auth-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }

    private record Repositories(
            AuthorizationFlowRepository authorizationFlows,
            DeviceFlowRepository deviceFlows,
            RefreshTokenRepository refreshTokens,
            PilotSecretRepository pilotSecrets) {}
}
