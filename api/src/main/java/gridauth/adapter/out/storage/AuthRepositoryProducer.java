package gridauth.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import gridauth.core.port.out.AuthorizationFlowRepository;
import gridauth.core.port.out.DeviceFlowRepository;
import gridauth.core.port.out.PilotSecretRepository;
import gridauth.core.port.out.RefreshTokenRepository;
import gridauth.core.service.auth.AuthStorageProviderRegistry;

/**
 * CDI producer for the token core repositories.
 *
 * <p>Delegates to the {@link AuthStorageProviderRegistry}, which selects the
 * configured {@link gridauth.spi.AuthStorageProvider}.
 */
@ApplicationScoped
public class AuthRepositoryProducer {

    private final AuthStorageProviderRegistry registry;

    @Inject
    public AuthRepositoryProducer(AuthStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public AuthorizationFlowRepository authorizationFlowRepository() {
        return registry.getSelectedProvider().authorizationFlows();
    }

    @Produces
    @ApplicationScoped
    public DeviceFlowRepository deviceFlowRepository() {
        return registry.getSelectedProvider().deviceFlows();
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenRepository refreshTokenRepository() {
        return registry.getSelectedProvider().refreshTokens();
    }

    @Produces
    @ApplicationScoped
    public PilotSecretRepository pilotSecretRepository() {
        return registry.getSelectedProvider().pilotSecrets();
    }
}
