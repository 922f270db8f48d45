package gridauth.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gridauth.core.port.out.AuthorizationFlowRepository;
import gridauth.core.port.out.DeviceFlowRepository;
import gridauth.core.port.out.PilotSecretRepository;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.spi.AuthStorageProvider;

/**
 * In-memory storage provider for single-instance deployments, development and tests.
 *
 * <p>A daemon thread purges expired flows every minute, so abandoned flows do not
 * accumulate even when the scheduled cleanup jobs are disabled.
 *
 * <p><strong>Warning:</strong> state is lost on restart and not shared across
 * instances. Use {@code redis} when running more than one instance.
 */
@ApplicationScoped
public class InMemoryAuthStorageProvider implements AuthStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthStorageProvider.class);
    private static final int PRIORITY = 0;

    private final InMemoryAuthorizationFlowRepository authorizationFlows = new InMemoryAuthorizationFlowRepository();
    private final InMemoryDeviceFlowRepository deviceFlows = new InMemoryDeviceFlowRepository();
    private final InMemoryRefreshTokenRepository refreshTokens = new InMemoryRefreshTokenRepository();
    private final InMemoryPilotSecretRepository pilotSecrets = new InMemoryPilotSecretRepository();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAuthStorageProvider() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "auth-flow-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::purgeExpiredFlows, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public AuthorizationFlowRepository authorizationFlows() {
        return authorizationFlows;
    }

    @Override
    public DeviceFlowRepository deviceFlows() {
        return deviceFlows;
    }

    @Override
    public RefreshTokenRepository refreshTokens() {
        return refreshTokens;
    }

    @Override
    public PilotSecretRepository pilotSecrets() {
        return pilotSecrets;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("auth-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("authorizationFlows", authorizationFlows.size())
                .withData("deviceFlows", deviceFlows.size())
                .withData("refreshTokens", refreshTokens.size())
                .withData("pilotSecrets", pilotSecrets.size())
                .build());
    }

    private void purgeExpiredFlows() {
        final var now = Instant.now();
        Uni.combine()
                .all()
                .unis(authorizationFlows.purgeExpired(now), deviceFlows.purgeExpired(now))
                .discardItems()
                .subscribe()
                .with(ignored -> {}, e -> LOG.warn("Failed to purge expired flows", e));
    }

    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
