package gridauth.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import gridauth.core.model.auth.VerifiedToken;

/**
 * Identity of the bearer of an access token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserInfoResponse(
        String sub,
        String vo,
        String diracGroup,
        List<String> properties,
        String preferredUsername,
        String pilotStamp,
        String jobId,
        Instant expiresAt) {

    public static UserInfoResponse from(VerifiedToken token) {
        return new UserInfoResponse(
                token.subject(),
                token.vo(),
                token.group(),
                token.properties(),
                token.preferredUsername(),
                token.pilotStamp(),
                token.jobId(),
                token.expiresAt());
    }
}
