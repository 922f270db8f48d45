package gridauth.core.model.flow;

import java.time.Instant;
import java.util.Objects;

/**
 * An in-progress authorization-code flow.
 *
 * @param id            opaque flow id, carried inside the encrypted IdP state
 * @param clientId      OAuth2 client that started the flow
 * @param scope         validated scope string
 * @param redirectUri   where the user agent is sent back to with the code
 * @param codeChallenge S256 PKCE challenge
 * @param externalState client state echoed back on redirect
 * @param status        flow status
 * @param createdAt     start time
 * @param expiresAt     end of the flow lifetime
 * @param codeHash      SHA-256 hex of the authorization code, set on completion
 * @param identity      IdP identity, set on completion
 */
public record AuthorizationFlowRecord(
        String id,
        String clientId,
        String scope,
        String redirectUri,
        String codeChallenge,
        String externalState,
        FlowStatus status,
        Instant createdAt,
        Instant expiresAt,
        String codeHash,
        IdpIdentity identity) {

    public AuthorizationFlowRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public static AuthorizationFlowRecord pending(
            String id,
            String clientId,
            String scope,
            String redirectUri,
            String codeChallenge,
            String externalState,
            Instant now,
            Instant expiresAt) {
        return new AuthorizationFlowRecord(
                id,
                clientId,
                scope,
                redirectUri,
                codeChallenge,
                externalState,
                FlowStatus.PENDING,
                now,
                expiresAt,
                null,
                null);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public AuthorizationFlowRecord authorize(String newCodeHash, IdpIdentity idpIdentity) {
        return new AuthorizationFlowRecord(
                id,
                clientId,
                scope,
                redirectUri,
                codeChallenge,
                externalState,
                FlowStatus.AUTHORIZED,
                createdAt,
                expiresAt,
                newCodeHash,
                idpIdentity);
    }

    public AuthorizationFlowRecord withStatus(FlowStatus newStatus) {
        return new AuthorizationFlowRecord(
                id,
                clientId,
                scope,
                redirectUri,
                codeChallenge,
                externalState,
                newStatus,
                createdAt,
                expiresAt,
                codeHash,
                identity);
    }
}
