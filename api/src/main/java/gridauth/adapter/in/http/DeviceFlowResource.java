package gridauth.adapter.in.http;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gridauth.adapter.in.dto.DeviceAuthorizationResponse;
import gridauth.core.port.in.FlowUseCase;

/**
 * Device authorization grant endpoints (RFC 8628).
 *
 * <p>The device starts the flow and polls the token endpoint. The user opens the
 * verification page in a browser, is sent to the identity provider and lands on a
 * static page once the device can collect its tokens.
 */
@Path("/api/auth/device")
@ApplicationScoped
public class DeviceFlowResource {

    static final String FINISHED_PAGE = """
            <!DOCTYPE html>
            <html>
            <head><title>Login complete</title></head>
            <body>
            <p>Login successful. You may now close this window and return to your device.</p>
            </body>
            </html>
            """;

    private final FlowUseCase flows;

    @Inject
    public DeviceFlowResource(FlowUseCase flows) {
        this.flows = flows;
    }

    /**
     * Device authorization request.
     */
    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<DeviceAuthorizationResponse> startDeviceFlow(
            @FormParam("client_id") String clientId,
            @FormParam("scope") String scope,
            @FormParam("code_challenge") String codeChallenge,
            @FormParam("code_challenge_method") String codeChallengeMethod) {
        return flows.startDevice(clientId, scope, codeChallenge, codeChallengeMethod)
                .map(DeviceAuthorizationResponse::from);
    }

    /**
     * Verification page: look up the user code and send the user to the identity provider.
     *
     * @return 303 See Other to the identity provider
     */
    @GET
    public Uni<Response> verify(@QueryParam("user_code") String userCode) {
        return flows.beginDeviceVerification(userCode)
                .map(url -> Response.seeOther(URI.create(url)).build());
    }

    /**
     * Identity provider callback of the device flow.
     */
    @GET
    @Path("/complete")
    public Uni<Response> complete(
            @QueryParam("code") String code, @QueryParam("error") String error, @QueryParam("state") String state) {
        return flows.completeFlow(code, error, state).map(FlowCallbacks::toResponse);
    }

    @GET
    @Path("/complete/finished")
    @Produces(MediaType.TEXT_HTML)
    public String finished() {
        return FINISHED_PAGE;
    }
}
