package gridauth.core.port.out;

import gridauth.core.model.auth.CredentialKind;

/**
 * Port interface for recording token core metrics.
 */
public interface AuthMetrics {

    void recordTokensIssued(CredentialKind kind, String grant);

    void recordReplayDetected(int revokedCount);

    void recordFlowCompleted(String grant, String outcome);

    void recordPilotSecretConsumed(boolean success);
}
