package gridauth.core.model.flow;

import java.util.Arrays;
import java.util.Optional;

/**
 * OAuth2 grant types accepted by the token endpoint.
 */
public enum GrantType {
    AUTHORIZATION_CODE("authorization_code"),
    DEVICE_CODE("urn:ietf:params:oauth:grant-type:device_code"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        return Arrays.stream(values()).filter(g -> g.value.equals(value)).findFirst();
    }
}
