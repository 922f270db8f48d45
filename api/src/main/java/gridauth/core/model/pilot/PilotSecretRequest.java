package gridauth.core.model.pilot;

import java.time.Duration;
import java.util.Set;

/**
 * Administrative request to issue pilot secrets.
 *
 * @param count       number of secrets to create
 * @param vo          VO the pilots will act for
 * @param maxUses     uses per secret
 * @param lifetime    lifetime of each secret, null for the configured default
 * @param pilotStamps stamp constraint, empty for any
 * @param sites       site constraint, empty for any
 */
public record PilotSecretRequest(
        int count, String vo, int maxUses, Duration lifetime, Set<String> pilotStamps, Set<String> sites) {

    public PilotSecretRequest {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
        if (maxUses < 1) {
            maxUses = 1;
        }
        pilotStamps = pilotStamps != null ? Set.copyOf(pilotStamps) : Set.of();
        sites = sites != null ? Set.copyOf(sites) : Set.of();
    }
}
