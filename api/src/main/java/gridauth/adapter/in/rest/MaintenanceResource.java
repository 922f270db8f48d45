package gridauth.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.port.in.FlowUseCase;
import gridauth.core.port.in.PilotSecretManagement;
import gridauth.core.port.in.RefreshTokenManagement;

/**
 * On-demand cleanup of expired state, for deployments that keep the scheduled jobs off.
 */
@Path("/admin/maintenance")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.SERVICE_ADMINISTRATOR)
public class MaintenanceResource {

    private static final Logger LOG = Logger.getLogger(MaintenanceResource.class);

    private final FlowUseCase flows;
    private final RefreshTokenManagement refreshTokens;
    private final PilotSecretManagement pilotSecrets;

    @Inject
    public MaintenanceResource(
            FlowUseCase flows, RefreshTokenManagement refreshTokens, PilotSecretManagement pilotSecrets) {
        this.flows = flows;
        this.refreshTokens = refreshTokens;
        this.pilotSecrets = pilotSecrets;
    }

    /**
     * Remove expired flows, refresh tokens and pilot secrets.
     */
    @POST
    @Path("/purge")
    public Uni<PurgeResponse> purgeExpired() {
        return Uni.combine()
                .all()
                .unis(flows.purgeExpired(), refreshTokens.purgeExpired(), pilotSecrets.purgeExpiredSecrets())
                .asTuple()
                .map(counts -> new PurgeResponse(counts.getItem1(), counts.getItem2(), counts.getItem3()))
                .invoke(purged -> LOG.infov(
                        "Purged {0} flows, {1} refresh tokens, {2} pilot secrets",
                        purged.flows(), purged.refreshTokens(), purged.pilotSecrets()));
    }

    public record PurgeResponse(int flows, int refreshTokens, int pilotSecrets) {}
}
