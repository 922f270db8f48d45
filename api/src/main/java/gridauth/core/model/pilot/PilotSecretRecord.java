package gridauth.core.model.pilot;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Stored form of a pilot secret. The secret itself is never stored.
 *
 * @param secretHash  SHA-256 hex of the secret, also the store key
 * @param vo          VO the pilot will act for
 * @param pilotStamps stamps allowed to use the secret, empty for any
 * @param sites       sites allowed to use the secret, empty for any
 * @param maxUses     how many times the secret may be consumed
 * @param useCount    how many times it was consumed
 * @param createdAt   issue time
 * @param expiresAt   expiry
 * @param lastUsedAt  time of the last consumption, null if never used
 */
public record PilotSecretRecord(
        String secretHash,
        String vo,
        Set<String> pilotStamps,
        Set<String> sites,
        int maxUses,
        int useCount,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt) {

    public PilotSecretRecord {
        Objects.requireNonNull(secretHash, "secretHash is required");
        Objects.requireNonNull(vo, "vo is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        pilotStamps = pilotStamps != null ? Set.copyOf(pilotStamps) : Set.of();
        sites = sites != null ? Set.copyOf(sites) : Set.of();
        if (maxUses < 1) {
            throw new IllegalArgumentException("maxUses must be at least 1");
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isExhausted() {
        return useCount >= maxUses;
    }

    /**
     * Whether this consumption is the last one the secret allows.
     */
    public boolean isLastUse() {
        return useCount + 1 >= maxUses;
    }

    /**
     * Check the stamp and site constraints. A null site only passes when no site constraint exists.
     */
    public boolean allows(String pilotStamp, String site) {
        if (!pilotStamps.isEmpty() && !pilotStamps.contains(pilotStamp)) {
            return false;
        }
        return sites.isEmpty() || (site != null && sites.contains(site));
    }

    public PilotSecretRecord consumedAt(Instant now) {
        return new PilotSecretRecord(
                secretHash, vo, pilotStamps, sites, maxUses, useCount + 1, createdAt, expiresAt, now);
    }
}
