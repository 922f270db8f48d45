package gridauth.core.exception;

/**
 * The IdP refused the inner code exchange or returned an ID token that failed verification.
 */
public class UpstreamRejectedException extends AuthException {

    public UpstreamRejectedException(String message) {
        super(message);
    }

    public UpstreamRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
