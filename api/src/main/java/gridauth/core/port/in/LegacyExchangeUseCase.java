package gridauth.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.IssuedTokens;

/**
 * Port for the legacy system's token exchange.
 */
public interface LegacyExchangeUseCase {

    boolean isEnabled();

    /**
     * Mint tokens for a user known to the legacy system.
     *
     * @param authorization   raw {@code Authorization} header value
     * @param preferredUsername user name, resolved to a subject through the VO's user registry
     * @param scope           requested scope
     * @param expiresMinutes  optional access-token lifetime override
     */
    Uni<IssuedTokens> exchange(
            String authorization, String preferredUsername, String scope, Optional<Integer> expiresMinutes);
}
