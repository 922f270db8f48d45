package gridauth.core.model.auth;

/**
 * Lifecycle status of a signing key.
 *
 * <pre>
 * ACTIVE → RETIRING → REVOKED
 * </pre>
 */
public enum KeyStatus {

    /**
     * Signs new tokens and verifies existing ones. At most one key is ACTIVE.
     */
    ACTIVE,

    /**
     * Verification only. Stays here until every token it signed has expired.
     */
    RETIRING,

    /**
     * Not used for anything; kept for audit until the retention period ends.
     */
    REVOKED
}
