package gridauth.core.model.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * How to reach the external IdP of a VO.
 *
 * @param serverMetadataUrl OpenID discovery document URL
 * @param clientId          client id registered at the IdP; also the expected ID token audience
 * @param clientSecret      client secret for confidential clients
 */
public record IdpSettings(String serverMetadataUrl, String clientId, Optional<String> clientSecret) {

    public IdpSettings {
        Objects.requireNonNull(serverMetadataUrl, "serverMetadataUrl is required");
        Objects.requireNonNull(clientId, "clientId is required");
        clientSecret = clientSecret != null ? clientSecret : Optional.empty();
    }
}
