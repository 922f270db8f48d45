package gridauth.adapter.in.dto;

import java.time.Duration;
import java.util.Set;

import gridauth.core.model.pilot.PilotSecretRequest;

/**
 * DTO for pilot secret issuance.
 *
 * @param count           number of secrets to create (required, at least 1)
 * @param vo              VO the secrets belong to (required)
 * @param maxUses         uses per secret, defaults to 1
 * @param lifetimeSeconds lifetime per secret, defaults to the configured secret lifetime
 * @param pilotStamps     stamps allowed to use the secrets, empty for any
 * @param sites           sites allowed to use the secrets, empty for any
 */
public record IssuePilotSecretsRequest(
        Integer count, String vo, Integer maxUses, Long lifetimeSeconds, Set<String> pilotStamps, Set<String> sites) {

    public PilotSecretRequest toRequest() {
        if (vo == null || vo.isBlank()) {
            throw new IllegalArgumentException("vo is required");
        }
        if (lifetimeSeconds != null && lifetimeSeconds <= 0) {
            throw new IllegalArgumentException("lifetime_seconds must be positive");
        }
        return new PilotSecretRequest(
                count != null ? count : 1,
                vo,
                maxUses != null ? maxUses : 1,
                lifetimeSeconds != null ? Duration.ofSeconds(lifetimeSeconds) : null,
                pilotStamps,
                sites);
    }
}
