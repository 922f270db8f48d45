package gridauth.core.model.auth;

/**
 * Names of the installation-specific JWT claims.
 */
public final class TokenClaims {

    public static final String VO = "vo";
    public static final String GROUP = "dirac_group";
    public static final String PROPERTIES = "dirac_properties";
    public static final String PREFERRED_USERNAME = "preferred_username";
    public static final String PILOT_STAMP = "pilot_stamp";
    public static final String JOB_ID = "job_id";
    public static final String LEGACY_EXCHANGE = "legacy_exchange";
    public static final String TOKEN_TYPE = "typ";

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_REFRESH = "refresh";

    private TokenClaims() {}
}
