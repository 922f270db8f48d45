package gridauth.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import gridauth.core.service.auth.SigningKeyRegistry;

/**
 * Readiness check for token signing.
 *
 * <p>DOWN while no ACTIVE key is loaded, since every grant would fail.
 */
@Readiness
@ApplicationScoped
public class SigningKeyHealthCheck implements HealthCheck {

    private final SigningKeyRegistry registry;

    @Inject
    public SigningKeyHealthCheck(SigningKeyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var snapshot = registry.snapshot();
        final var builder = HealthCheckResponse.named("signing-keys")
                .withData("snapshot.version", snapshot.version())
                .withData("verification.keys", snapshot.publicKeys().size());
        snapshot.signingKey().ifPresent(key -> builder.withData("active.kid", key.keyId()));
        return builder.status(registry.isReady()).build();
    }
}
