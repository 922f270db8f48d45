package gridauth.core.model.auth;

import java.time.Instant;

/**
 * A compact JWS with the identifiers callers need to track it.
 *
 * @param token     compact serialization
 * @param jti       the {@code jti} claim
 * @param expiresAt the {@code exp} claim
 */
public record SignedToken(String token, String jti, Instant expiresAt) {}
