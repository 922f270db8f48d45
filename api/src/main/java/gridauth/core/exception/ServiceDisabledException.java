package gridauth.core.exception;

/**
 * Exception thrown when an optional operation has not been configured on this installation.
 */
public class ServiceDisabledException extends AuthException {

    public ServiceDisabledException(String message) {
        super(message);
    }
}
