package gridauth.core.exception;

/**
 * The IdP timed out or failed during the inner code exchange. The user may retry the flow;
 * the server never retries on its own.
 */
public class UpstreamUnavailableException extends AuthException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
