package gridauth.core.model.auth;

import java.time.Instant;
import java.util.List;

/**
 * Claims of an access token whose signature, issuer, audience and expiry were checked.
 *
 * @param jti               token id
 * @param subject           VO-qualified principal ({@code sub})
 * @param vo                virtual organization
 * @param group             group, null for pilot and job credentials
 * @param properties        embedded capabilities
 * @param preferredUsername human-readable name, may be null
 * @param issuedAt          {@code iat}
 * @param expiresAt         {@code exp}
 * @param keyId             key that signed the token
 * @param pilotStamp        pilot stamp for pilot and job credentials
 * @param jobId             job id for job credentials
 * @param legacyExchange    whether minted by the legacy exchange
 */
public record VerifiedToken(
        String jti,
        String subject,
        String vo,
        String group,
        List<String> properties,
        String preferredUsername,
        Instant issuedAt,
        Instant expiresAt,
        String keyId,
        String pilotStamp,
        String jobId,
        boolean legacyExchange) {

    public VerifiedToken {
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public boolean hasProperty(String property) {
        return properties.contains(property);
    }

    public boolean isJobCredential() {
        return jobId != null;
    }
}
