package gridauth.adapter.out.registry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import gridauth.core.config.RegistryConfig;
import gridauth.core.model.registry.GroupSettings;
import gridauth.core.model.registry.IdpSettings;
import gridauth.core.model.registry.VoSettings;
import gridauth.spi.CapabilityResolver;

/**
 * Capability resolver backed by the {@code gridauth.registry} configuration.
 *
 * <h2>Configuration</h2>
 * <pre>
 * gridauth.registry.vos.lhcb.default-group=lhcb_user
 * gridauth.registry.vos.lhcb.idp.server-metadata-url=https://idp.example/.well-known/openid-configuration
 * gridauth.registry.vos.lhcb.idp.client-id=gridauth
 * gridauth.registry.vos.lhcb.users."b824d4dc-..."=chaen
 * gridauth.registry.vos.lhcb.groups.lhcb_user.properties=NormalUser
 * gridauth.registry.vos.lhcb.groups.lhcb_user.members=b824d4dc-...
 * </pre>
 *
 * <p>The configuration is read once at startup.
 */
@ApplicationScoped
public class ConfigCapabilityResolver implements CapabilityResolver {

    private static final Logger LOG = Logger.getLogger(ConfigCapabilityResolver.class);

    private final Map<String, VoSettings> vos;
    private final Set<String> availableProperties;

    @Inject
    public ConfigCapabilityResolver(RegistryConfig config) {
        this.availableProperties = Set.copyOf(config.availableProperties());
        this.vos = config.vos().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> toSettings(e.getKey(), e.getValue())));
        LOG.infov("Loaded capability registry with {0} VOs", vos.size());
    }

    @Override
    public Optional<VoSettings> vo(String name) {
        return Optional.ofNullable(vos.get(name));
    }

    @Override
    public Set<String> availableProperties() {
        return availableProperties;
    }

    private VoSettings toSettings(String name, RegistryConfig.Vo vo) {
        final var groups = vo.groups().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> new GroupSettings(
                        e.getKey(),
                        Set.copyOf(e.getValue().properties().orElse(List.of())),
                        Set.copyOf(e.getValue().members().orElse(List.of())))));

        if (!groups.containsKey(vo.defaultGroup())) {
            throw new IllegalStateException(
                    "Default group " + vo.defaultGroup() + " of VO " + name + " is not defined");
        }
        for (var group : groups.values()) {
            for (var property : group.properties()) {
                if (!availableProperties.contains(property)) {
                    throw new IllegalStateException(
                            "Group " + group.name() + " of VO " + name + " grants unknown property " + property);
                }
            }
        }

        final var idp = new IdpSettings(vo.idp().serverMetadataUrl(), vo.idp().clientId(), vo.idp().clientSecret());
        return new VoSettings(name, vo.defaultGroup(), idp, vo.users(), groups);
    }
}
