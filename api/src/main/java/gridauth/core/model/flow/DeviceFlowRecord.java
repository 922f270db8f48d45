package gridauth.core.model.flow;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An in-progress device flow.
 *
 * @param id            SHA-256 hex of the device code
 * @param userCode      code typed by the user on the verification page
 * @param clientId      OAuth2 client that started the flow
 * @param scope         validated scope string
 * @param codeChallenge S256 PKCE challenge
 * @param pollInterval  minimum interval between polls
 * @param status        flow status
 * @param createdAt     start time
 * @param expiresAt     end of the flow lifetime
 * @param lastPolledAt  time of the previous poll, null before the first
 * @param identity      IdP identity, set on completion
 */
public record DeviceFlowRecord(
        String id,
        String userCode,
        String clientId,
        String scope,
        String codeChallenge,
        Duration pollInterval,
        FlowStatus status,
        Instant createdAt,
        Instant expiresAt,
        Instant lastPolledAt,
        IdpIdentity identity) {

    public DeviceFlowRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(userCode, "userCode is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        Objects.requireNonNull(pollInterval, "pollInterval is required");
    }

    public static DeviceFlowRecord pending(
            String id,
            String userCode,
            String clientId,
            String scope,
            String codeChallenge,
            Duration pollInterval,
            Instant now,
            Instant expiresAt) {
        return new DeviceFlowRecord(
                id,
                userCode,
                clientId,
                scope,
                codeChallenge,
                pollInterval,
                FlowStatus.PENDING,
                now,
                expiresAt,
                null,
                null);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Whether a poll at {@code now} comes sooner than the poll interval allows.
     */
    public boolean isPolledTooSoon(Instant now) {
        return lastPolledAt != null && now.isBefore(lastPolledAt.plus(pollInterval));
    }

    public DeviceFlowRecord polledAt(Instant now) {
        return new DeviceFlowRecord(
                id, userCode, clientId, scope, codeChallenge, pollInterval, status, createdAt, expiresAt, now, identity);
    }

    public DeviceFlowRecord authorize(IdpIdentity idpIdentity) {
        return new DeviceFlowRecord(
                id,
                userCode,
                clientId,
                scope,
                codeChallenge,
                pollInterval,
                FlowStatus.AUTHORIZED,
                createdAt,
                expiresAt,
                lastPolledAt,
                idpIdentity);
    }

    public DeviceFlowRecord withStatus(FlowStatus newStatus) {
        return new DeviceFlowRecord(
                id,
                userCode,
                clientId,
                scope,
                codeChallenge,
                pollInterval,
                newStatus,
                createdAt,
                expiresAt,
                lastPolledAt,
                identity);
    }
}
