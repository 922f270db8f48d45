package gridauth.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.flow.DeviceFlowRecord;

/**
 * Port interface for device flow storage.
 *
 * <p>Records are keyed by the device code hash and indexed by user code.
 * {@link #replace} must be an atomic compare-and-swap.
 */
public interface DeviceFlowRepository {

    /**
     * Insert a new flow.
     *
     * @return true if stored, false if the device code hash or the user code is already taken
     */
    Uni<Boolean> insert(DeviceFlowRecord flow);

    Uni<Optional<DeviceFlowRecord>> findById(String deviceCodeHash);

    Uni<Optional<DeviceFlowRecord>> findByUserCode(String userCode);

    /**
     * Replace {@code expected} with {@code replacement} if the stored record still equals {@code expected}.
     *
     * @return true if this call performed the swap
     */
    Uni<Boolean> replace(DeviceFlowRecord expected, DeviceFlowRecord replacement);

    /**
     * Remove flows whose lifetime ended before {@code now}, whatever their status.
     */
    Uni<Integer> purgeExpired(Instant now);
}
