package gridauth.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import gridauth.core.service.auth.AuthStorageProviderRegistry;
import gridauth.spi.StorageProviderException;

/**
 * Readiness check for the selected auth storage provider.
 *
 * <p>Delegates to the provider's own health check when it has one.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private final AuthStorageProviderRegistry registry;

    @Inject
    public StorageHealthCheck(AuthStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            final var provider = registry.getSelectedProvider();
            return provider.healthCheck()
                    .orElseGet(() -> HealthCheckResponse.named("auth-storage")
                            .withData("provider", provider.name())
                            .status(provider.isAvailable())
                            .build());
        } catch (StorageProviderException e) {
            return HealthCheckResponse.named("auth-storage")
                    .withData("error", e.getMessage())
                    .down()
                    .build();
        }
    }
}
