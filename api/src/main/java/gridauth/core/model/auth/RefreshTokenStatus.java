package gridauth.core.model.auth;

/**
 * Status of a refresh token record.
 *
 * <pre>
 * ACTIVE → ROTATED   (refreshed; kept for replay detection)
 * ACTIVE → REVOKED   (explicit revocation, chain or subject revocation)
 * ROTATED → REVOKED  (chain revocation)
 * </pre>
 */
public enum RefreshTokenStatus {
    ACTIVE,
    ROTATED,
    REVOKED
}
