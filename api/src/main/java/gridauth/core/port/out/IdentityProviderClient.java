package gridauth.core.port.out;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.flow.IdpIdentity;
import gridauth.core.model.registry.IdpSettings;

/**
 * Port interface for the OAuth2/OpenID client side of the inner IdP exchange.
 *
 * <p>Implementations bound every call by a timeout and never retry a code exchange.
 * Timeouts, I/O errors and IdP 5xx responses fail with
 * {@link gridauth.core.exception.UpstreamUnavailableException}; refusals and ID tokens
 * failing verification fail with {@link gridauth.core.exception.UpstreamRejectedException}.
 */
public interface IdentityProviderClient {

    /**
     * Resolve the IdP authorization endpoint from its discovery document.
     */
    Uni<String> authorizationEndpoint(IdpSettings idp);

    /**
     * Exchange an IdP authorization code and verify the returned ID token.
     *
     * @param idp          IdP settings of the VO
     * @param code         authorization code returned by the IdP
     * @param codeVerifier PKCE verifier generated when the redirect was built
     * @param redirectUri  callback URI used in the authorization request
     * @return the verified identity
     */
    Uni<IdpIdentity> exchangeCode(IdpSettings idp, String code, String codeVerifier, String redirectUri);
}
