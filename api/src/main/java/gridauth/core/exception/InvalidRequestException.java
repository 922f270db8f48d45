package gridauth.core.exception;

/**
 * Malformed request: bad PKCE values, unknown scope, wrong client or redirect.
 * Rejected before any state change.
 */
public class InvalidRequestException extends AuthException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
