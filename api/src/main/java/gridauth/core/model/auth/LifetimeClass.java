package gridauth.core.model.auth;

/**
 * Which configured lifetime applies to a minted access token.
 */
public enum LifetimeClass {
    USER,
    PILOT,
    JOB
}
