package gridauth.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import gridauth.core.port.out.AuthorizationFlowRepository;
import gridauth.core.port.out.DeviceFlowRepository;
import gridauth.core.port.out.PilotSecretRepository;
import gridauth.core.port.out.RefreshTokenRepository;

/**
 * SPI for the transactional stores of the token core.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - shared storage for multi-instance deployments</li>
 *   <li>memory (priority: 0) - single instance, development and tests</li>
 * </ul>
 *
 * <p>The provider named by {@code gridauth.storage.provider} is used. Unlike a
 * cache, these stores hold security state, so an unavailable configured provider
 * is an error rather than a reason to fall back to memory.
 *
 * <p>Every repository returned must implement its {@code replace} operations as
 * atomic compare-and-swap.
 */
public interface AuthStorageProvider {

    /**
     * Provider name matched against {@code gridauth.storage.provider}.
     */
    String name();

    /**
     * Priority used to order providers in diagnostics (higher = more preferred).
     */
    int priority();

    /**
     * Whether the backing store is usable.
     */
    boolean isAvailable();

    AuthorizationFlowRepository authorizationFlows();

    DeviceFlowRepository deviceFlows();

    RefreshTokenRepository refreshTokens();

    PilotSecretRepository pilotSecrets();

    /**
     * Health of the backing store for {@code /q/health}.
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
