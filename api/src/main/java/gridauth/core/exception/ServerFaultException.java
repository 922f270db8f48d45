package gridauth.core.exception;

/**
 * Exception thrown when the server cannot complete an operation for reasons the caller
 * neither caused nor can correct, such as an identifier collision or a store that keeps
 * losing updates.
 */
public class ServerFaultException extends AuthException {

    public ServerFaultException(String message) {
        super(message);
    }

    public ServerFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
