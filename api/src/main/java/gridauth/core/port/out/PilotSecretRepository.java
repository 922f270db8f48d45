package gridauth.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.pilot.PilotSecretRecord;

/**
 * Port interface for hashed pilot secrets.
 *
 * <p>Consumption uses {@link #replace} to count a use and {@link #remove} to
 * delete a secret on its last use; both must be atomic compare-and-swap operations.
 */
public interface PilotSecretRepository {

    /**
     * @return true if stored, false if a secret with the same hash exists
     */
    Uni<Boolean> insert(PilotSecretRecord secret);

    Uni<Optional<PilotSecretRecord>> findByHash(String secretHash);

    Uni<Boolean> replace(PilotSecretRecord expected, PilotSecretRecord replacement);

    /**
     * Delete the secret only if the stored record still equals {@code expected}.
     */
    Uni<Boolean> remove(PilotSecretRecord expected);

    /**
     * Remove secrets that expired before {@code now}.
     */
    Uni<Integer> purgeExpired(Instant now);
}
