package gridauth.core.exception;

/**
 * Base of the failures the token core reports to its callers.
 *
 * <p>Each subclass maps to one HTTP problem type at the adapter boundary.
 */
public abstract class AuthException extends RuntimeException {

    protected AuthException(String message) {
        super(message);
    }

    protected AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
