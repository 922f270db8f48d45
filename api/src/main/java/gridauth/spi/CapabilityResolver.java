package gridauth.spi;

import java.util.Optional;
import java.util.Set;

import gridauth.core.model.registry.VoSettings;

/**
 * SPI giving read-only access to the VO registry: groups, their capabilities,
 * their members, and the IdP of each VO.
 *
 * <p>The token core consults it on every mint and every refresh, so capability
 * changes take effect at the next refresh. Implementations must be cheap to call;
 * cache remote sources behind this interface.
 *
 * <p>The built-in implementation reads the {@code gridauth.registry} configuration.
 * Installations synchronizing from another system register an alternative:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class LegacyRegistryCapabilityResolver implements CapabilityResolver {
 * }
 * }</pre>
 */
public interface CapabilityResolver {

    /**
     * Look up a VO by name.
     */
    Optional<VoSettings> vo(String name);

    /**
     * Every capability name the installation knows about.
     */
    Set<String> availableProperties();
}
