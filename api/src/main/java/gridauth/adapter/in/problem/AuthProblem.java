package gridauth.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for authorization server errors.
 *
 * <p>Every problem carries an {@code error} extension member holding the OAuth 2.0 error
 * code (RFC 6749 section 5.2, RFC 8628 section 3.5), so OAuth clients can branch on it
 * while other clients read the standard problem fields.
 */
public final class AuthProblem {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_TOKEN = "invalid_token";
    public static final String ACCESS_DENIED = "access_denied";
    public static final String AUTHORIZATION_PENDING = "authorization_pending";
    public static final String SLOW_DOWN = "slow_down";
    public static final String EXPIRED_TOKEN = "expired_token";
    public static final String UNSUPPORTED_GRANT_TYPE = "unsupported_grant_type";
    public static final String TEMPORARILY_UNAVAILABLE = "temporarily_unavailable";
    public static final String SERVER_ERROR = "server_error";

    private AuthProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem invalidRequest(String detail) {
        return oauth("Invalid Request", Status.BAD_REQUEST, INVALID_REQUEST, detail);
    }

    public static HttpProblem invalidGrant(String detail) {
        return oauth("Invalid Grant", Status.BAD_REQUEST, INVALID_GRANT, detail);
    }

    public static HttpProblem unsupportedGrantType(String grantType) {
        return oauth(
                "Unsupported Grant Type",
                Status.BAD_REQUEST,
                UNSUPPORTED_GRANT_TYPE,
                "Grant type '%s' is not supported".formatted(grantType));
    }

    // ========== Device Polling ==========

    public static HttpProblem authorizationPending() {
        return oauth(
                "Authorization Pending",
                Status.BAD_REQUEST,
                AUTHORIZATION_PENDING,
                "The user has not yet completed the authorization");
    }

    public static HttpProblem slowDown() {
        return oauth("Slow Down", Status.BAD_REQUEST, SLOW_DOWN, "Polling too frequently");
    }

    public static HttpProblem expiredToken(String detail) {
        return oauth("Expired Token", Status.BAD_REQUEST, EXPIRED_TOKEN, detail);
    }

    // ========== Authentication/Authorization Errors ==========

    public static HttpProblem invalidClient(String detail) {
        return oauth("Invalid Client", Status.UNAUTHORIZED, INVALID_CLIENT, detail);
    }

    public static HttpProblem invalidToken(String detail) {
        return oauth("Invalid Token", Status.UNAUTHORIZED, INVALID_TOKEN, detail);
    }

    public static HttpProblem replayDetected(String detail) {
        return oauth("Invalid Grant", Status.UNAUTHORIZED, INVALID_GRANT, detail);
    }

    public static HttpProblem accessDenied(String detail) {
        return oauth("Access Denied", Status.FORBIDDEN, ACCESS_DENIED, detail);
    }

    // ========== Not Found ==========

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    // ========== Upstream and Server Errors ==========

    public static HttpProblem badGateway(String detail) {
        return oauth("Bad Gateway", Status.BAD_GATEWAY, TEMPORARILY_UNAVAILABLE, detail);
    }

    public static HttpProblem serverError(String detail) {
        return oauth("Internal Server Error", Status.INTERNAL_SERVER_ERROR, SERVER_ERROR, detail);
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return oauth("Service Unavailable", Status.SERVICE_UNAVAILABLE, TEMPORARILY_UNAVAILABLE, detail);
    }

    private static HttpProblem oauth(String title, Status status, String error, String detail) {
        return HttpProblem.builder()
                .withTitle(title)
                .withStatus(status)
                .withDetail(detail)
                .with("error", error)
                .build();
    }
}
