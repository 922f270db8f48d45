package gridauth.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the interactive OAuth2 flows (authorization code and device).
 *
 * <p>Configuration prefix: {@code gridauth.auth.flows}
 */
@ConfigMapping(prefix = "gridauth.auth.flows")
public interface FlowConfig {

    /**
     * The only OAuth2 client id accepted by the flows.
     */
    @WithName("client-id")
    @WithDefault("myDIRACClientID")
    String clientId();

    /**
     * Redirect URIs a client may ask the authorization flow to return to.
     */
    @WithName("allowed-redirects")
    @WithDefault("http://localhost:8000/docs/oauth2-redirect")
    List<String> allowedRedirects();

    /**
     * How long an authorization flow stays usable after it starts.
     */
    @WithName("authorization-flow-lifetime")
    @WithDefault("PT5M")
    Duration authorizationFlowLifetime();

    /**
     * How long a device flow stays usable after it starts.
     */
    @WithName("device-flow-lifetime")
    @WithDefault("PT10M")
    Duration deviceFlowLifetime();

    /**
     * Minimum interval between two polls of the same device code.
     */
    @WithName("poll-interval")
    @WithDefault("PT5S")
    Duration pollInterval();

    /**
     * Length of the human-typed device user code.
     */
    @WithName("user-code-length")
    @WithDefault("8")
    int userCodeLength();

    /**
     * Base64-encoded 256-bit AES key encrypting the state carried through the IdP redirect.
     *
     * <p>When absent, a random key is generated at startup; flows then cannot
     * survive a restart or span several instances.
     */
    @WithName("state-key")
    Optional<String> stateKey();

    /**
     * Externally visible base URL of this service, used to build IdP callback URLs.
     */
    @WithName("public-base-url")
    @WithDefault("http://localhost:8080")
    String publicBaseUrl();
}
