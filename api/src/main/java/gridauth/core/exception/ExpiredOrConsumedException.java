package gridauth.core.exception;

/**
 * The flow, code, secret or token is unknown, expired, revoked or already used.
 *
 * <p>These cases share one exception (and one message per call site) so callers
 * cannot tell them apart. The OAuth error code tells the HTTP boundary which
 * protocol error to report.
 */
public class ExpiredOrConsumedException extends AuthException {

    public static final String INVALID_GRANT = "invalid_grant";
    public static final String EXPIRED_TOKEN = "expired_token";
    public static final String INVALID_CLIENT = "invalid_client";

    private final String error;

    public ExpiredOrConsumedException(String message) {
        this(message, INVALID_GRANT);
    }

    public ExpiredOrConsumedException(String message, String error) {
        super(message);
        this.error = error;
    }

    public String getError() {
        return error;
    }
}
