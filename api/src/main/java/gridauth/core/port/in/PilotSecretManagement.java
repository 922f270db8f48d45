package gridauth.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.pilot.IssuedPilotSecret;
import gridauth.core.model.pilot.PilotSecretRequest;

/**
 * Port for provisioning pilot secrets.
 */
public interface PilotSecretManagement {

    /**
     * Generate and store secrets. Raw values are returned once and only their hashes are kept.
     */
    Uni<List<IssuedPilotSecret>> issueSecrets(PilotSecretRequest request);

    Uni<Integer> purgeExpiredSecrets();
}
