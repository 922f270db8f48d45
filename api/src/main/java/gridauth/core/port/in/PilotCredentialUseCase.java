package gridauth.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.model.pilot.JobAssignment;
import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.JobOutcome;
import gridauth.core.model.pilot.PilotLogin;

/**
 * Port for the pilot credential pipeline.
 *
 * <p>secret → pilot credential → one job credential per matched job → revoked on finalization.
 */
public interface PilotCredentialUseCase {

    /**
     * Exchange a pilot secret for a pilot credential.
     */
    Uni<IssuedTokens> consumePilotSecret(PilotLogin login);

    /**
     * Rotate a pilot refresh token. The stamp must match the one it was issued to.
     */
    Uni<IssuedTokens> refreshPilotCredential(String rawRefreshToken, String pilotStamp);

    /**
     * Ask for a job on behalf of an authenticated pilot.
     *
     * @return Uni with the job and its credential, or empty when nothing matched
     */
    Uni<Optional<JobAssignment>> matchJob(VerifiedToken pilot, JobMatchRequest request);

    /**
     * Revoke the credentials of a job held by the calling pilot. Idempotent.
     *
     * @param caller the pilot credential, or the job credential of {@code jobId}
     * @throws gridauth.core.exception.PermissionDeniedException (as a failed Uni) when live
     *     credentials of the job belong to another pilot
     */
    Uni<Void> finalizeJob(VerifiedToken caller, String jobId, JobOutcome outcome);

    /**
     * Check that a job credential is still live for its job.
     */
    Uni<VerifiedToken> authorizeJobCredential(String rawToken, String jobId);
}
