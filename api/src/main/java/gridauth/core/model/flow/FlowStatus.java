package gridauth.core.model.flow;

/**
 * Status of an authorization or device flow.
 *
 * <pre>
 * PENDING → AUTHORIZED → COMPLETED
 * PENDING → DENIED
 * any     → EXPIRED
 * </pre>
 */
public enum FlowStatus {

    /** Waiting for the user to authenticate at the IdP. */
    PENDING,

    /** The IdP vouched for the user; tokens can be collected once. */
    AUTHORIZED,

    /** Tokens were collected. */
    COMPLETED,

    /** Lifetime elapsed before completion. */
    EXPIRED,

    /** The IdP refused or the user cancelled. */
    DENIED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED || this == DENIED;
    }
}
