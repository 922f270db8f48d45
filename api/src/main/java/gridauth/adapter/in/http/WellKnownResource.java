package gridauth.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import gridauth.core.config.FlowConfig;
import gridauth.core.config.TokenConfig;
import gridauth.core.model.flow.GrantType;
import gridauth.core.service.auth.SigningKeyRegistry;

/**
 * Discovery documents under {@code /.well-known}.
 *
 * <p>The key set lists every key accepted for verification (ACTIVE and RETIRING), so
 * tokens signed before a rotation keep verifying downstream.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7517">RFC 7517 - JSON Web Key (JWK)</a>
 * @see <a href="https://tools.ietf.org/html/rfc8414">RFC 8414 - Authorization Server Metadata</a>
 */
@Path("/.well-known")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    private static final Logger LOG = Logger.getLogger(WellKnownResource.class);
    static final int CACHE_MAX_AGE_SECONDS = 300;

    private final SigningKeyRegistry keyRegistry;
    private final TokenConfig tokenConfig;
    private final FlowConfig flowConfig;

    @Inject
    public WellKnownResource(SigningKeyRegistry keyRegistry, TokenConfig tokenConfig, FlowConfig flowConfig) {
        this.keyRegistry = keyRegistry;
        this.tokenConfig = tokenConfig;
        this.flowConfig = flowConfig;
    }

    @GET
    @Path("/jwks.json")
    public Response getJwks() {
        final var keys = keyRegistry.publicKeys();
        if (keys.isEmpty()) {
            LOG.warn("No verification keys available");
        }
        LOG.debugv("Returning JWKS with {0} keys", keys.size());
        return Response.ok(JwkSetFactory.jwks(keys))
                .header("Cache-Control", "public, max-age=" + CACHE_MAX_AGE_SECONDS)
                .build();
    }

    @GET
    @Path("/openid-configuration")
    public Map<String, Object> getConfiguration() {
        final var base = flowConfig.publicBaseUrl();
        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("issuer", tokenConfig.issuer());
        metadata.put("authorization_endpoint", base + "/api/auth/authorize");
        metadata.put("device_authorization_endpoint", base + "/api/auth/device");
        metadata.put("token_endpoint", base + "/api/auth/token");
        metadata.put("revocation_endpoint", base + "/api/auth/revoke");
        metadata.put("userinfo_endpoint", base + "/api/auth/userinfo");
        metadata.put("jwks_uri", base + "/.well-known/jwks.json");
        metadata.put("grant_types_supported", List.of(
                GrantType.AUTHORIZATION_CODE.value(), GrantType.DEVICE_CODE.value(), GrantType.REFRESH_TOKEN.value()));
        metadata.put("response_types_supported", List.of("code"));
        metadata.put("scopes_supported", List.of("vo:<vo>", "group:<group>", "property:<property>"));
        metadata.put("token_endpoint_auth_methods_supported", List.of("none"));
        metadata.put("id_token_signing_alg_values_supported", List.of("RS256"));
        metadata.put("code_challenge_methods_supported", List.of("S256"));
        return metadata;
    }
}
