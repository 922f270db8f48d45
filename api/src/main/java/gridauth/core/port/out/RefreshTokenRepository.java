package gridauth.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.RefreshTokenRecord;

/**
 * Port interface for refresh token records.
 *
 * <p>Rotated and revoked records are kept until they expire; replay detection
 * depends on them. {@link #replace} must be an atomic compare-and-swap.
 */
public interface RefreshTokenRepository {

    Uni<Void> insert(RefreshTokenRecord record);

    Uni<Optional<RefreshTokenRecord>> findByJti(String jti);

    /**
     * Replace {@code expected} with {@code replacement} if the stored record still equals {@code expected}.
     *
     * @return true if this call performed the swap
     */
    Uni<Boolean> replace(RefreshTokenRecord expected, RefreshTokenRecord replacement);

    /**
     * All records of a rotation chain, including the root.
     */
    Uni<List<RefreshTokenRecord>> findByRoot(String rootJti);

    /**
     * All records of a VO-qualified subject.
     */
    Uni<List<RefreshTokenRecord>> findBySubject(String subject);

    /**
     * All records backing credentials of one job.
     */
    Uni<List<RefreshTokenRecord>> findByJobId(String jobId);

    /**
     * All records of one pilot (its own credentials and its job credentials).
     */
    Uni<List<RefreshTokenRecord>> findByPilotStamp(String pilotStamp);

    /**
     * Remove records that expired before {@code now}.
     */
    Uni<Integer> purgeExpired(Instant now);
}
