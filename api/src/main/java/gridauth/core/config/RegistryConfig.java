package gridauth.core.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Static VO registry: groups, capabilities, users and IdP settings per VO.
 *
 * <p>Example:
 * <pre>{@code
 * gridauth.registry.vos.lhcb.default-group=lhcb_user
 * gridauth.registry.vos.lhcb.idp.server-metadata-url=https://idp.example.org/.well-known/openid-configuration
 * gridauth.registry.vos.lhcb.idp.client-id=lhcb-client
 * gridauth.registry.vos.lhcb.users.b824d4dc=chaen
 * gridauth.registry.vos.lhcb.groups.lhcb_user.properties=NormalUser
 * gridauth.registry.vos.lhcb.groups.lhcb_user.members=b824d4dc
 * }</pre>
 */
@ConfigMapping(prefix = "gridauth.registry")
public interface RegistryConfig {

    /**
     * Capability names this installation knows about. Scope requests naming
     * anything else are malformed.
     */
    @WithName("available-properties")
    @WithDefault("NormalUser,GenericPilot,JobExecution,ServiceAdministrator,JobAdministrator")
    List<String> availableProperties();

    Map<String, Vo> vos();

    interface Vo {

        @WithName("default-group")
        String defaultGroup();

        Idp idp();

        /**
         * IdP subject to preferred username.
         */
        Map<String, String> users();

        Map<String, Group> groups();
    }

    interface Idp {

        @WithName("server-metadata-url")
        String serverMetadataUrl();

        @WithName("client-id")
        String clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();
    }

    interface Group {

        Optional<List<String>> properties();

        /**
         * IdP subjects allowed to use this group.
         */
        Optional<List<String>> members();
    }
}
