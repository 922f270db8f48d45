package gridauth.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a successful grant: an access token and, usually, a refresh token.
 *
 * @param accessToken      signed access token
 * @param accessExpiresAt  access token expiry
 * @param refreshToken     signed refresh handle, null when none is issued (legacy refresh, job credential)
 * @param refreshExpiresAt refresh token expiry, null when no refresh token is issued
 * @param accessJti        id of the access token
 */
public record IssuedTokens(
        String accessToken, Instant accessExpiresAt, String refreshToken, Instant refreshExpiresAt, String accessJti) {

    public IssuedTokens {
        Objects.requireNonNull(accessToken, "accessToken is required");
        Objects.requireNonNull(accessExpiresAt, "accessExpiresAt is required");
    }

    public boolean hasRefreshToken() {
        return refreshToken != null;
    }

    public IssuedTokens withoutRefreshToken() {
        return new IssuedTokens(accessToken, accessExpiresAt, null, null, accessJti);
    }
}
