package gridauth.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import gridauth.core.model.auth.CredentialKind;
import gridauth.core.port.out.AuthMetrics;

/**
 * Records token core metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code gridauth.tokens.issued} - Tokens issued by credential kind and grant</li>
 *   <li>{@code gridauth.refresh.replay} - Refresh token replays detected</li>
 *   <li>{@code gridauth.refresh.replay.revoked} - Refresh tokens revoked because of a replay</li>
 *   <li>{@code gridauth.flows.completed} - Interactive flows finished, by grant and outcome</li>
 *   <li>{@code gridauth.pilot.secrets.consumed} - Pilot secret consumption attempts by result</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordTokensIssued(CredentialKind kind, String grant) {
        Counter.builder("gridauth.tokens.issued")
                .description("Number of token sets issued")
                .tag("kind", kind.name().toLowerCase())
                .tag("grant", grant)
                .register(registry)
                .increment();
    }

    @Override
    public void recordReplayDetected(int revokedCount) {
        Counter.builder("gridauth.refresh.replay")
                .description("Number of refresh token replays detected")
                .register(registry)
                .increment();
        Counter.builder("gridauth.refresh.replay.revoked")
                .description("Number of refresh tokens revoked after a replay")
                .register(registry)
                .increment(revokedCount);
    }

    @Override
    public void recordFlowCompleted(String grant, String outcome) {
        Counter.builder("gridauth.flows.completed")
                .description("Number of interactive flows finished")
                .tag("grant", grant)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordPilotSecretConsumed(boolean success) {
        Counter.builder("gridauth.pilot.secrets.consumed")
                .description("Number of pilot secret consumption attempts")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
