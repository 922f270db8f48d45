package gridauth.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gridauth.adapter.in.dto.IssuePilotSecretsRequest;
import gridauth.adapter.in.dto.IssuedPilotSecretResponse;
import gridauth.adapter.in.problem.AuthProblem;
import gridauth.core.port.in.PilotSecretManagement;

/**
 * REST resource for pilot secret administration.
 *
 * <p>Plaintext secrets appear only in the creation response.
 */
@Path("/admin/pilots")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.SERVICE_ADMINISTRATOR)
public class PilotSecretResource {

    private final PilotSecretManagement pilotSecrets;

    @Inject
    public PilotSecretResource(PilotSecretManagement pilotSecrets) {
        this.pilotSecrets = pilotSecrets;
    }

    @POST
    @Path("/secrets")
    public Uni<Response> issueSecrets(IssuePilotSecretsRequest request) {
        if (request == null) {
            throw AuthProblem.invalidRequest("Request body is required");
        }
        return pilotSecrets.issueSecrets(request.toRequest()).map(secrets -> {
            final List<IssuedPilotSecretResponse> body =
                    secrets.stream().map(IssuedPilotSecretResponse::from).toList();
            return Response.status(Response.Status.CREATED).entity(body).build();
        });
    }
}
