package gridauth.core.exception;

/**
 * A presented token failed signature, issuer, audience, type or expiry checks.
 */
public class InvalidTokenException extends AuthException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
