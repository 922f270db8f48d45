package gridauth.core.model.flow;

import gridauth.core.model.auth.IssuedTokens;

/**
 * Outcome of polling a device flow.
 */
public sealed interface DevicePollResult {

    /** The user has not finished authenticating yet. */
    record Pending() implements DevicePollResult {}

    /** Polled sooner than the poll interval allows. */
    record SlowDown() implements DevicePollResult {}

    /** Unknown device code, or the flow ran out of time. */
    record Expired() implements DevicePollResult {}

    /** The IdP refused or the user cancelled. */
    record Denied() implements DevicePollResult {}

    /** The flow was consumed by this poll. */
    record Ready(IssuedTokens tokens) implements DevicePollResult {}
}
