package gridauth.adapter.in.dto;

import java.time.Instant;

import gridauth.core.model.pilot.IssuedPilotSecret;

/**
 * A newly issued pilot secret. The plaintext is returned once and never stored.
 */
public record IssuedPilotSecretResponse(String pilotSecret, String vo, int maxUses, Instant expiresAt) {

    public static IssuedPilotSecretResponse from(IssuedPilotSecret secret) {
        return new IssuedPilotSecretResponse(secret.secret(), secret.vo(), secret.maxUses(), secret.expiresAt());
    }
}
