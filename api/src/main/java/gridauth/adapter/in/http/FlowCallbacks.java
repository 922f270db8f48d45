package gridauth.adapter.in.http;

import java.net.URI;

import jakarta.ws.rs.core.Response;

import gridauth.core.model.flow.FlowCompletion;

/**
 * Turns the outcome of an IdP callback into the redirect sent to the user agent.
 */
final class FlowCallbacks {

    static final String DEVICE_FINISHED_PATH = "/api/auth/device/complete/finished";

    private FlowCallbacks() {}

    static Response toResponse(FlowCompletion completion) {
        if (completion instanceof FlowCompletion.ClientRedirect redirect) {
            return Response.seeOther(URI.create(redirect.redirectUrl())).build();
        }
        return Response.seeOther(URI.create(DEVICE_FINISHED_PATH)).build();
    }
}
