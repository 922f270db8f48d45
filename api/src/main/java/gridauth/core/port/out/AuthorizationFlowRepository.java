package gridauth.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.flow.AuthorizationFlowRecord;

/**
 * Port interface for authorization-code flow storage.
 *
 * <p>Every status transition goes through {@link #replace}, which must be an
 * atomic compare-and-swap: of two callers replacing the same expected record,
 * exactly one observes {@code true}.
 */
public interface AuthorizationFlowRepository {

    /**
     * Insert a new flow.
     *
     * @return true if stored, false if the id is already taken
     */
    Uni<Boolean> insert(AuthorizationFlowRecord flow);

    Uni<Optional<AuthorizationFlowRecord>> findById(String id);

    /**
     * Look up a flow by the hash of the code issued on completion.
     */
    Uni<Optional<AuthorizationFlowRecord>> findByCodeHash(String codeHash);

    /**
     * Replace {@code expected} with {@code replacement} if the stored record still equals {@code expected}.
     *
     * @return true if this call performed the swap
     */
    Uni<Boolean> replace(AuthorizationFlowRecord expected, AuthorizationFlowRecord replacement);

    /**
     * Remove flows whose lifetime ended before {@code now}, whatever their status.
     *
     * @return number of removed flows (implementations relying on native TTLs may return 0)
     */
    Uni<Integer> purgeExpired(Instant now);
}
