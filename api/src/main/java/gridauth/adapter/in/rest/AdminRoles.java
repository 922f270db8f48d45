package gridauth.adapter.in.rest;

/**
 * Token properties that unlock the admin endpoints. Properties are mapped to security roles
 * one to one.
 */
public final class AdminRoles {

    public static final String SERVICE_ADMINISTRATOR = "ServiceAdministrator";

    private AdminRoles() {}
}
