package gridauth.core.model.flow;

/**
 * Outcome of the IdP callback.
 */
public sealed interface FlowCompletion {

    /**
     * Authorization flow: send the user agent back to the client.
     *
     * @param redirectUrl client redirect URI with {@code code} and {@code state}
     */
    record ClientRedirect(String redirectUrl) implements FlowCompletion {}

    /**
     * Device flow: the device may now collect its tokens.
     *
     * @param userCode the completed user code
     */
    record DeviceAuthorized(String userCode) implements FlowCompletion {}
}
