package gridauth.core.model.pilot;

import java.time.Instant;

/**
 * A freshly issued pilot secret. The plaintext is only available here.
 */
public record IssuedPilotSecret(String secret, String vo, int maxUses, Instant expiresAt) {}
