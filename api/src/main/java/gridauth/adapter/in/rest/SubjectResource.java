package gridauth.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.model.auth.Identity;
import gridauth.core.port.in.RefreshTokenManagement;
import gridauth.core.util.SecureHash;

/**
 * REST resource for per-subject administration.
 */
@Path("/admin/subjects")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.SERVICE_ADMINISTRATOR)
public class SubjectResource {

    private static final Logger LOG = Logger.getLogger(SubjectResource.class);

    private final RefreshTokenManagement refreshTokens;

    @Inject
    public SubjectResource(RefreshTokenManagement refreshTokens) {
        this.refreshTokens = refreshTokens;
    }

    /**
     * Revoke every refresh token of a subject, for example after a compromise.
     *
     * @param subject VO-qualified subject ({@code vo:sub})
     * @return number of tokens revoked
     */
    @DELETE
    @Path("/{subject}/refresh-tokens")
    public Uni<RevocationResponse> revokeAll(@PathParam("subject") String subject) {
        // Rejects subjects without a VO prefix
        Identity.splitPrincipal(subject);
        LOG.infov("Admin revocation of all refresh tokens of {0}", SecureHash.truncatedSha256(subject, 12));
        return refreshTokens.revokeAllForSubject(subject).map(RevocationResponse::new);
    }

    public record RevocationResponse(int revoked) {}
}
