package gridauth.core.exception;

/**
 * No active signing key exists. Fatal at startup.
 */
public class SigningKeyUnavailableException extends AuthException {

    public SigningKeyUnavailableException(String message) {
        super(message);
    }
}
