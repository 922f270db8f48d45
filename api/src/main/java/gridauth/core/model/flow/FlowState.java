package gridauth.core.model.flow;

import java.util.Objects;

/**
 * Minimal state needed to resume a flow after the IdP redirect.
 *
 * <p>Travels through the user agent encrypted; the orchestrator trusts it only
 * after decrypting it with the installation key.
 *
 * @param grantType       which flow the state belongs to
 * @param flowRef         authorization flow id, or device user code
 * @param vo              VO whose IdP was used
 * @param idpCodeVerifier PKCE verifier of the inner IdP exchange
 * @param issuedAt        epoch seconds at which the state was created
 */
public record FlowState(GrantType grantType, String flowRef, String vo, String idpCodeVerifier, long issuedAt) {

    public FlowState {
        Objects.requireNonNull(grantType, "grantType is required");
        Objects.requireNonNull(flowRef, "flowRef is required");
        Objects.requireNonNull(vo, "vo is required");
        Objects.requireNonNull(idpCodeVerifier, "idpCodeVerifier is required");
    }
}
