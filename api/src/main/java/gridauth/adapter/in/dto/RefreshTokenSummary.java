package gridauth.adapter.in.dto;

import java.time.Instant;

import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.RefreshTokenRecord;
import gridauth.core.model.auth.RefreshTokenStatus;

/**
 * A refresh token as shown to its owner. Lineage is not exposed.
 */
public record RefreshTokenSummary(
        String jti, CredentialKind kind, String scope, RefreshTokenStatus status, Instant createdAt, Instant expiresAt) {

    public static RefreshTokenSummary from(RefreshTokenRecord record) {
        return new RefreshTokenSummary(
                record.jti(), record.kind(), record.scope(), record.status(), record.createdAt(), record.expiresAt());
    }
}
