package gridauth.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import gridauth.adapter.in.auth.BearerIdentityProvider;
import gridauth.adapter.in.dto.FinalizeJobRequest;
import gridauth.adapter.in.dto.JobMatchRequestDto;
import gridauth.adapter.in.dto.JobMatchResponse;
import gridauth.adapter.in.dto.PilotLoginRequest;
import gridauth.adapter.in.dto.PilotRefreshRequest;
import gridauth.adapter.in.dto.TokenResponse;
import gridauth.adapter.in.problem.AuthProblem;
import gridauth.core.config.PilotConfig;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.model.pilot.JobOutcome;
import gridauth.core.port.in.PilotCredentialUseCase;

/**
 * Pilot endpoints.
 *
 * <p>A pilot trades its one-time secret for a pilot credential, matches jobs with it and
 * receives a job-scoped credential per match. A job is finalized by its pilot or by the
 * job credential itself.
 */
@Path("/api/pilots")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PilotResource {

    private static final String BEARER_PREFIX = "Bearer ";

    private final PilotCredentialUseCase pilotCredentials;
    private final PilotConfig pilotConfig;
    private final SecurityIdentity identity;

    @Inject
    public PilotResource(PilotCredentialUseCase pilotCredentials, PilotConfig pilotConfig, SecurityIdentity identity) {
        this.pilotCredentials = pilotCredentials;
        this.pilotConfig = pilotConfig;
        this.identity = identity;
    }

    @POST
    @Path("/token")
    public Uni<TokenResponse> exchangeSecret(PilotLoginRequest request) {
        if (request == null || request.pilotSecret() == null || request.pilotSecret().isBlank()) {
            throw AuthProblem.invalidRequest("pilot_secret is required");
        }
        return pilotCredentials.consumePilotSecret(request.toLogin()).map(TokenResponse::from);
    }

    @POST
    @Path("/refresh-token")
    public Uni<TokenResponse> refresh(PilotRefreshRequest request) {
        if (request == null || request.refreshToken() == null || request.refreshToken().isBlank()) {
            throw AuthProblem.invalidRequest("refresh_token is required");
        }
        return pilotCredentials
                .refreshPilotCredential(request.refreshToken(), request.pilotStamp())
                .map(TokenResponse::from);
    }

    /**
     * Match a job for the calling pilot.
     *
     * @return 200 with the job and its credential, or 204 No Content when nothing matched
     */
    @POST
    @Path("/jobs/match")
    @Authenticated
    public Uni<Response> matchJob(JobMatchRequestDto request) {
        final var offer = request != null ? request : new JobMatchRequestDto(null, null, null);
        return pilotCredentials.matchJob(bearer(), offer.toRequest()).map(assignment -> assignment
                .map(a -> Response.ok(JobMatchResponse.from(a)).build())
                .orElseGet(() -> Response.noContent().build()));
    }

    /**
     * Finalize a job. Its job credentials stop authorizing. Finalizing twice is harmless, but
     * a pilot cannot finalize a job held by another pilot.
     */
    @POST
    @Path("/jobs/{jobId}/finalize")
    @Authenticated
    public Uni<Response> finalizeJob(
            @PathParam("jobId") String jobId,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            FinalizeJobRequest request) {
        final var token = bearer();
        final var outcome = request != null ? request.outcomeOrDefault() : JobOutcome.SUCCEEDED;

        final Uni<VerifiedToken> authorized;
        if (token.isJobCredential()) {
            authorized = pilotCredentials.authorizeJobCredential(rawToken(authorization), jobId);
        } else if (token.pilotStamp() != null && token.hasProperty(pilotConfig.pilotCapability())) {
            authorized = Uni.createFrom().item(token);
        } else {
            throw AuthProblem.accessDenied("A pilot or job credential is required to finalize a job");
        }
        return authorized
                .flatMap(caller -> pilotCredentials.finalizeJob(caller, jobId, outcome))
                .map(v -> Response.noContent().build());
    }

    private VerifiedToken bearer() {
        final VerifiedToken token = identity.getAttribute(BearerIdentityProvider.TOKEN_ATTRIBUTE);
        if (token == null) {
            throw AuthProblem.invalidToken("A bearer access token is required");
        }
        return token;
    }

    private static String rawToken(String authorization) {
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
