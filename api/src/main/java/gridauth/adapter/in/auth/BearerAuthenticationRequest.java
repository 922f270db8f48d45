package gridauth.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying a bearer access token issued by this server.
 */
public class BearerAuthenticationRequest extends BaseAuthenticationRequest {

    private final String token;

    public BearerAuthenticationRequest(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
