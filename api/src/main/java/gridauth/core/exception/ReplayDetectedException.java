package gridauth.core.exception;

/**
 * A rotated refresh token was presented again. Its whole chain has been revoked
 * by the time this is thrown.
 */
public class ReplayDetectedException extends AuthException {

    private final String rootJti;
    private final int revokedCount;

    public ReplayDetectedException(String rootJti, int revokedCount) {
        super("Refresh token reuse detected: you must authenticate again");
        this.rootJti = rootJti;
        this.revokedCount = revokedCount;
    }

    public String getRootJti() {
        return rootJti;
    }

    public int getRevokedCount() {
        return revokedCount;
    }
}
