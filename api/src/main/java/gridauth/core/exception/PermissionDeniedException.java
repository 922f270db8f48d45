package gridauth.core.exception;

/**
 * The caller asked for something its identity does not allow.
 */
public class PermissionDeniedException extends AuthException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
