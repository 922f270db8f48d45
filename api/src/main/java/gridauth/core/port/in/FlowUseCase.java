package gridauth.core.port.in;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.flow.AuthorizationCodeGrant;
import gridauth.core.model.flow.AuthorizationFlowStart;
import gridauth.core.model.flow.DeviceCodeGrant;
import gridauth.core.model.flow.DeviceFlowStart;
import gridauth.core.model.flow.DevicePollResult;
import gridauth.core.model.flow.FlowCompletion;

/**
 * Port for the interactive OAuth2 flows.
 *
 * <p>Both flows delegate the login to the IdP of the requested VO and end with a
 * token exchange guarded by PKCE.
 */
public interface FlowUseCase {

    /**
     * Start an authorization code flow.
     *
     * @return Uni with the flow id and the IdP URL to send the browser to
     */
    Uni<AuthorizationFlowStart> startAuthorization(
            String clientId,
            String scope,
            String redirectUri,
            String codeChallenge,
            String challengeMethod,
            String externalState);

    /**
     * Start a device flow.
     */
    Uni<DeviceFlowStart> startDevice(String clientId, String scope, String codeChallenge, String challengeMethod);

    /**
     * Handle the user opening the verification page with their user code.
     *
     * @return Uni with the IdP URL to send the browser to
     */
    Uni<String> beginDeviceVerification(String userCode);

    /**
     * Handle the IdP callback of either flow.
     *
     * @param idpCode        authorization code issued by the IdP, null on error
     * @param idpError       error reported by the IdP, null on success
     * @param encryptedState state produced when the flow was handed to the IdP
     */
    Uni<FlowCompletion> completeFlow(String idpCode, String idpError, String encryptedState);

    /**
     * Poll a device flow, exchanging it for tokens once authorized.
     */
    Uni<DevicePollResult> pollDevice(DeviceCodeGrant grant);

    /**
     * Exchange an authorization code for tokens. Succeeds at most once per code.
     */
    Uni<IssuedTokens> exchange(AuthorizationCodeGrant grant);

    /**
     * Delete expired flows of both kinds.
     *
     * @return Uni with the number of records removed
     */
    Uni<Integer> purgeExpired();
}
