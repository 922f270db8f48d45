package gridauth.core.service.auth;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import gridauth.core.config.StorageConfig;
import gridauth.spi.AuthStorageProvider;
import gridauth.spi.StorageProviderException;

/**
 * Registry for the stores of flows, refresh tokens and pilot secrets.
 *
 * <p>Discovers providers via CDI and selects the one named by
 * {@code gridauth.storage.provider}. There is no fallback: running a
 * multi-instance deployment on per-instance memory would silently break
 * single-use codes and replay detection, so an unknown or unavailable provider
 * fails with {@link StorageProviderException}.
 */
@ApplicationScoped
public class AuthStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(AuthStorageProviderRegistry.class);

    private final Instance<AuthStorageProvider> providers;
    private final StorageConfig config;

    private volatile AuthStorageProvider selectedProvider;

    @Inject
    public AuthStorageProviderRegistry(Instance<AuthStorageProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Get the selected storage provider.
     *
     * @throws StorageProviderException if the configured provider is unknown or unavailable
     */
    public synchronized AuthStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private AuthStorageProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var all = providers.stream()
                .sorted(Comparator.comparingInt(AuthStorageProvider::priority).reversed())
                .toList();

        LOG.debugf("Known auth storage providers: %s", all.stream().map(AuthStorageProvider::name).toList());

        final var provider = all.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst()
                .orElseThrow(() -> new StorageProviderException("Unknown auth storage provider: " + configuredProvider));

        if (!provider.isAvailable()) {
            throw new StorageProviderException("Configured auth storage provider is not available: " + configuredProvider);
        }

        LOG.infof("Using auth storage provider: %s", provider.name());
        return provider;
    }

    /**
     * All providers known to CDI (for health checks and diagnostics).
     */
    public List<AuthStorageProvider> getProviders() {
        return providers.stream().toList();
    }
}
