package gridauth.core.model.auth;

/**
 * Kind of persisted refresh material.
 */
public enum CredentialKind {

    /** Issued through an interactive flow or the legacy exchange. */
    USER,

    /** Issued to a pilot in exchange for a pilot secret. */
    PILOT,

    /** Backs a single job credential; never refreshable. */
    JOB
}
