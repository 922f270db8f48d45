package gridauth.core.service.auth;

import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import gridauth.core.config.TokenConfig;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.TokenClaims;
import gridauth.core.model.auth.VerifiedToken;

/**
 * Verifies tokens signed by this installation.
 *
 * <p>Verification is stateless: it needs only the current key snapshot. The
 * {@code kid} header must name an ACTIVE or RETIRING key; {@code iss}, {@code aud},
 * {@code exp}, {@code jti} and the token type are checked with the configured clock skew.
 */
@ApplicationScoped
public class TokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenVerifier.class);

    private static final AlgorithmConstraints RS256_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);

    private final SigningKeyRegistry keyRegistry;
    private final TokenConfig config;

    @Inject
    public TokenVerifier(SigningKeyRegistry keyRegistry, TokenConfig config) {
        this.keyRegistry = keyRegistry;
        this.config = config;
    }

    /**
     * Verify an access token.
     *
     * @throws InvalidTokenException if the token is malformed, unsigned by a known key,
     *                               expired, or not an access token
     */
    public VerifiedToken verify(String rawToken) {
        final var claims = verifySignedClaims(rawToken, TokenClaims.TYPE_ACCESS);
        try {
            final var principal = Identity.splitPrincipal(claims.getSubject());
            return new VerifiedToken(
                    claims.getJwtId(),
                    claims.getSubject(),
                    principal[0],
                    claims.getStringClaimValue(TokenClaims.GROUP),
                    claims.hasClaim(TokenClaims.PROPERTIES)
                            ? claims.getStringListClaimValue(TokenClaims.PROPERTIES)
                            : List.of(),
                    claims.getStringClaimValue(TokenClaims.PREFERRED_USERNAME),
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()),
                    keyIdOf(rawToken),
                    claims.getStringClaimValue(TokenClaims.PILOT_STAMP),
                    claims.getStringClaimValue(TokenClaims.JOB_ID),
                    Boolean.TRUE.equals(claims.getClaimValue(TokenClaims.LEGACY_EXCHANGE, Boolean.class)));
        } catch (MalformedClaimException | IllegalArgumentException e) {
            throw new InvalidTokenException("Malformed token claims", e);
        }
    }

    /**
     * Verify a refresh token handle and return its {@code jti}.
     *
     * @throws InvalidTokenException if the handle is malformed, unsigned by a known key,
     *                               expired, or not a refresh handle
     */
    public String verifyRefreshHandle(String rawHandle) {
        final var claims = verifySignedClaims(rawHandle, TokenClaims.TYPE_REFRESH);
        try {
            return claims.getJwtId();
        } catch (MalformedClaimException e) {
            throw new InvalidTokenException("Malformed refresh token", e);
        }
    }

    private JwtClaims verifySignedClaims(String rawToken, String expectedType) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new InvalidTokenException("Missing token");
        }

        final var keyId = keyIdOf(rawToken);
        final var key = keyRegistry
                .verificationKey(keyId)
                .orElseThrow(() -> new InvalidTokenException("Unknown signing key: " + keyId));

        final var builder = new JwtConsumerBuilder()
                .setRequireJwtId()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                .setExpectedIssuer(config.issuer())
                .setExpectedAudience(config.audience())
                .setJwsAlgorithmConstraints(RS256_ONLY)
                .setVerificationKey(key.publicKey());
        if (TokenClaims.TYPE_ACCESS.equals(expectedType)) {
            builder.setRequireSubject();
        }

        final JwtClaims claims;
        try {
            claims = builder.build().processToClaims(rawToken);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            throw new InvalidTokenException(summarizeJwtError(e), e);
        }

        final var type = claims.getClaimValueAsString(TokenClaims.TOKEN_TYPE);
        if (!expectedType.equals(type)) {
            throw new InvalidTokenException("Unexpected token type: " + type);
        }
        return claims;
    }

    private static String keyIdOf(String rawToken) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(rawToken);
            final var keyId = jws.getKeyIdHeaderValue();
            if (keyId == null) {
                throw new InvalidTokenException("Token has no key id");
            }
            return keyId;
        } catch (JoseException e) {
            throw new InvalidTokenException("Failed to parse token: " + e.getMessage(), e);
        }
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.getMessage().contains("issuer")) {
            return "Invalid token issuer";
        }
        if (e.getMessage().contains("audience")) {
            return "Invalid token audience";
        }
        if (e.getMessage().contains("signature")) {
            return "Invalid token signature";
        }
        return "Token validation failed";
    }
}
