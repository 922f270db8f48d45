package gridauth.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted state of an issued refresh token (or of the material backing a job credential).
 *
 * @param jti               token id, also the key in the store
 * @param kind              what the token was issued for
 * @param subject           VO-qualified principal
 * @param vo                virtual organization
 * @param preferredUsername human-readable name, may be null
 * @param scope             scope string the token was issued with, re-resolved on refresh
 * @param parentJti         token this one was rotated from, null for a chain root
 * @param rootJti           first token of the rotation chain
 * @param status            lifecycle status
 * @param createdAt         issue time
 * @param expiresAt         expiry
 * @param legacyExchange    whether the token came from the legacy exchange (never rotated)
 * @param pilotStamp        pilot the token belongs to (PILOT and JOB kinds)
 * @param jobId             job the token is bound to (JOB kind)
 */
public record RefreshTokenRecord(
        String jti,
        CredentialKind kind,
        String subject,
        String vo,
        String preferredUsername,
        String scope,
        String parentJti,
        String rootJti,
        RefreshTokenStatus status,
        Instant createdAt,
        Instant expiresAt,
        boolean legacyExchange,
        String pilotStamp,
        String jobId) {

    public RefreshTokenRecord {
        Objects.requireNonNull(jti, "jti is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (rootJti == null) {
            rootJti = jti;
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsable(Instant now) {
        return status == RefreshTokenStatus.ACTIVE && !isExpired(now);
    }

    public RefreshTokenRecord withStatus(RefreshTokenStatus newStatus) {
        return new RefreshTokenRecord(
                jti,
                kind,
                subject,
                vo,
                preferredUsername,
                scope,
                parentJti,
                rootJti,
                newStatus,
                createdAt,
                expiresAt,
                legacyExchange,
                pilotStamp,
                jobId);
    }
}
