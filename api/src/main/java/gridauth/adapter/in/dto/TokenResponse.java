package gridauth.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import gridauth.core.model.auth.IssuedTokens;

/**
 * OAuth 2.0 token response (RFC 6749 section 5.1).
 *
 * @param accessToken  signed access token
 * @param tokenType    always {@code Bearer}
 * @param expiresIn    seconds until the access token expires
 * @param refreshToken refresh token, omitted when none was issued
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(String accessToken, String tokenType, long expiresIn, String refreshToken) {

    public static TokenResponse from(IssuedTokens tokens) {
        final var expiresIn = Math.max(0, Duration.between(Instant.now(), tokens.accessExpiresAt()).getSeconds());
        return new TokenResponse(tokens.accessToken(), "Bearer", expiresIn, tokens.refreshToken());
    }
}
