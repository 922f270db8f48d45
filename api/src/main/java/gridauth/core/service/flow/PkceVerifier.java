package gridauth.core.service.flow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import gridauth.core.exception.InvalidRequestException;
import gridauth.core.util.SecureTokens;

/**
 * PKCE (Proof Key for Code Exchange) checks.
 *
 * <p>Implements RFC 7636 with the S256 method only; {@code plain} offers no
 * protection against interception and is rejected.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceVerifier {

    private static final Logger LOG = Logger.getLogger(PkceVerifier.class);

    public static final String S256_METHOD = "S256";

    private static final Pattern CHALLENGE = Pattern.compile("[A-Za-z0-9_-]{43}");
    private static final Pattern VERIFIER = Pattern.compile("[A-Za-z0-9._~-]{43,128}");
    private static final int VERIFIER_BYTES = 48;

    /**
     * Validate a challenge received at flow start.
     *
     * @throws InvalidRequestException if the method is not S256 or the challenge is malformed
     */
    public void validateChallenge(String challenge, String method) {
        if (!S256_METHOD.equals(method)) {
            throw new InvalidRequestException("Unsupported code_challenge_method: " + method);
        }
        if (challenge == null || !CHALLENGE.matcher(challenge).matches()) {
            throw new InvalidRequestException("Malformed code_challenge");
        }
    }

    /**
     * Check a verifier against a stored challenge.
     *
     * @throws InvalidRequestException if the verifier is malformed or does not match
     */
    public void verify(String challenge, String verifier) {
        if (verifier == null || !VERIFIER.matcher(verifier).matches()) {
            throw new InvalidRequestException("Malformed code_verifier");
        }
        final var computed = challengeFor(verifier);
        if (!MessageDigest.isEqual(
                computed.getBytes(StandardCharsets.US_ASCII), challenge.getBytes(StandardCharsets.US_ASCII))) {
            LOG.debug("PKCE challenge mismatch");
            throw new InvalidRequestException("code_verifier does not match code_challenge");
        }
    }

    /**
     * Generate a verifier for the inner exchange with the IdP.
     */
    public String generateVerifier() {
        return SecureTokens.urlSafe(VERIFIER_BYTES);
    }

    /**
     * Compute BASE64URL(SHA256(verifier)).
     */
    public String challengeFor(String verifier) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
