package gridauth.adapter.in.http;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.adapter.in.auth.BearerIdentityProvider;
import gridauth.adapter.in.dto.RefreshTokenSummary;
import gridauth.adapter.in.dto.TokenResponse;
import gridauth.adapter.in.dto.UserInfoResponse;
import gridauth.adapter.in.problem.AuthProblem;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.model.flow.AuthorizationCodeGrant;
import gridauth.core.model.flow.DeviceCodeGrant;
import gridauth.core.model.flow.DevicePollResult;
import gridauth.core.model.flow.GrantType;
import gridauth.core.port.in.FlowUseCase;
import gridauth.core.port.in.LegacyExchangeUseCase;
import gridauth.core.port.in.RefreshTokenManagement;
import gridauth.core.service.auth.SigningKeyRegistry;

/**
 * OAuth 2.0 endpoints of the authorization server.
 *
 * <p>Implements the authorization code grant with PKCE (RFC 6749, RFC 7636), the token
 * endpoint for all supported grants, token revocation (RFC 7009) and the bearer's own
 * refresh token administration. The device authorization endpoints live in
 * {@link DeviceFlowResource}.
 *
 * <p>Token endpoint errors are problem+json documents with an OAuth {@code error} member.
 */
@Path("/api/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

    private static final Logger LOG = Logger.getLogger(OAuthResource.class);

    private final FlowUseCase flows;
    private final RefreshTokenManagement refreshTokens;
    private final LegacyExchangeUseCase legacyExchange;
    private final SigningKeyRegistry keyRegistry;
    private final SecurityIdentity identity;

    @Inject
    public OAuthResource(
            FlowUseCase flows,
            RefreshTokenManagement refreshTokens,
            LegacyExchangeUseCase legacyExchange,
            SigningKeyRegistry keyRegistry,
            SecurityIdentity identity) {
        this.flows = flows;
        this.refreshTokens = refreshTokens;
        this.legacyExchange = legacyExchange;
        this.keyRegistry = keyRegistry;
        this.identity = identity;
    }

    @GET
    @Path("/jwks")
    public Map<String, Object> getJwks() {
        return JwkSetFactory.jwks(keyRegistry.publicKeys());
    }

    /**
     * Start an authorization code flow and send the user agent to the VO's identity provider.
     *
     * @param responseType        must be {@code code}
     * @param clientId            registered client id
     * @param redirectUri         allow-listed redirect URI
     * @param scope               space separated {@code vo:}, {@code group:} and {@code property:} tokens
     * @param codeChallenge       PKCE S256 challenge
     * @param codeChallengeMethod must be {@code S256}
     * @param state               client state echoed back with the code
     * @return 303 See Other to the identity provider
     */
    @GET
    @Path("/authorize")
    public Uni<Response> authorize(
            @QueryParam("response_type") String responseType,
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("scope") String scope,
            @QueryParam("code_challenge") String codeChallenge,
            @QueryParam("code_challenge_method") String codeChallengeMethod,
            @QueryParam("state") String state) {
        if (!"code".equals(responseType)) {
            throw AuthProblem.invalidRequest("response_type must be 'code'");
        }
        return flows.startAuthorization(clientId, scope, redirectUri, codeChallenge, codeChallengeMethod, state)
                .map(start -> Response.seeOther(URI.create(start.idpRedirectUrl())).build());
    }

    /**
     * Identity provider callback of the authorization code flow.
     *
     * @return 303 See Other to the client redirect URI with {@code code} and {@code state}
     */
    @GET
    @Path("/authorize/complete")
    public Uni<Response> completeAuthorization(
            @QueryParam("code") String code, @QueryParam("error") String error, @QueryParam("state") String state) {
        return flows.completeFlow(code, error, state).map(FlowCallbacks::toResponse);
    }

    /**
     * Token endpoint for the authorization code, device code and refresh token grants.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<TokenResponse> token(
            @FormParam("grant_type") String grantType,
            @FormParam("client_id") String clientId,
            @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("code_verifier") String codeVerifier,
            @FormParam("device_code") String deviceCode,
            @FormParam("refresh_token") String refreshToken) {
        if (grantType == null || grantType.isBlank()) {
            throw AuthProblem.invalidRequest("grant_type is required");
        }
        final var grant = GrantType.fromValue(grantType)
                .orElseThrow(() -> AuthProblem.unsupportedGrantType(grantType));
        LOG.debugv("Token request with grant {0}", grant);

        final Uni<IssuedTokens> issued = switch (grant) {
            case AUTHORIZATION_CODE -> flows.exchange(
                    new AuthorizationCodeGrant(code, clientId, redirectUri, codeVerifier));
            case DEVICE_CODE -> flows.pollDevice(new DeviceCodeGrant(deviceCode, clientId, codeVerifier))
                    .map(OAuthResource::readyOrThrow);
            case REFRESH_TOKEN -> {
                if (refreshToken == null || refreshToken.isBlank()) {
                    throw AuthProblem.invalidRequest("refresh_token is required");
                }
                yield refreshTokens.refresh(refreshToken);
            }
        };
        return issued.map(TokenResponse::from);
    }

    static IssuedTokens readyOrThrow(DevicePollResult result) {
        if (result instanceof DevicePollResult.Ready ready) {
            return ready.tokens();
        }
        if (result instanceof DevicePollResult.Pending) {
            throw AuthProblem.authorizationPending();
        }
        if (result instanceof DevicePollResult.SlowDown) {
            throw AuthProblem.slowDown();
        }
        // Expired and denied flows are indistinguishable to the device
        throw AuthProblem.expiredToken("Device code expired or was denied");
    }

    /**
     * Revoke a refresh token and the rest of its chain (RFC 7009).
     *
     * <p>Always answers 200, whether or not the token was known.
     */
    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> revoke(@FormParam("token") String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(Response.ok().build());
        }
        return refreshTokens.revoke(token).map(v -> Response.ok().build());
    }

    /**
     * Mint tokens on behalf of the legacy system for one of its users.
     *
     * @param authorization  {@code Bearer diracx:legacy:<key>}
     * @param preferredUsername username of the user in the VO registry
     * @param scope          requested scope
     * @param expiresMinutes optional access token lifetime, capped by configuration
     */
    @GET
    @Path("/legacy-exchange")
    public Uni<TokenResponse> legacyExchange(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("preferred_username") String preferredUsername,
            @QueryParam("scope") String scope,
            @QueryParam("expires_minutes") Integer expiresMinutes) {
        return legacyExchange
                .exchange(authorization, preferredUsername, scope, Optional.ofNullable(expiresMinutes))
                .map(TokenResponse::from);
    }

    @GET
    @Path("/userinfo")
    @Authenticated
    public UserInfoResponse userInfo() {
        return UserInfoResponse.from(bearer());
    }

    /**
     * List the caller's refresh tokens that can still be used.
     */
    @GET
    @Path("/refresh-tokens")
    @Authenticated
    public Uni<List<RefreshTokenSummary>> listRefreshTokens() {
        return refreshTokens
                .listRefreshTokens(bearer().subject())
                .map(records -> records.stream().map(RefreshTokenSummary::from).toList());
    }

    /**
     * Revoke one of the caller's own refresh tokens.
     *
     * @return 204 No Content, 403 if the token belongs to someone else
     */
    @DELETE
    @Path("/refresh-tokens/{jti}")
    @Authenticated
    public Uni<Response> revokeRefreshToken(@PathParam("jti") String jti) {
        return refreshTokens
                .revokeRefreshTokenById(bearer().subject(), jti)
                .map(v -> Response.noContent().build());
    }

    private VerifiedToken bearer() {
        final VerifiedToken token = identity.getAttribute(BearerIdentityProvider.TOKEN_ATTRIBUTE);
        if (token == null) {
            throw AuthProblem.invalidToken("A bearer access token is required");
        }
        return token;
    }
}
