package gridauth.mock;

import java.util.Map;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;

import io.quarkus.test.Mock;
import io.smallrye.mutiny.Uni;

import gridauth.core.exception.UpstreamRejectedException;
import gridauth.core.model.flow.IdpIdentity;
import gridauth.core.model.registry.IdpSettings;
import gridauth.core.port.out.IdentityProviderClient;

/**
 * Mock identity provider for tests.
 *
 * <p>Codes {@value #ALICE_CODE}, {@value #BOB_CODE} and {@value #CAROL_CODE} log in the
 * matching user without any HTTP call. Any other code is refused.
 */
@Mock
@Alternative
@Priority(1)
@ApplicationScoped
public class MockIdentityProviderClient implements IdentityProviderClient {

    public static final String AUTHORIZATION_ENDPOINT = "http://idp.test/authorize";
    public static final String ALICE_CODE = "alice-code";
    public static final String BOB_CODE = "bob-code";
    public static final String CAROL_CODE = "carol-code";

    private static final Map<String, IdpIdentity> IDENTITIES = Map.of(
            ALICE_CODE, new IdpIdentity("http://idp.test", "alice-sub", "alice"),
            BOB_CODE, new IdpIdentity("http://idp.test", "bob-sub", "bob"),
            CAROL_CODE, new IdpIdentity("http://idp.test", "carol-sub", "carol"));

    @Override
    public Uni<String> authorizationEndpoint(IdpSettings idp) {
        return Uni.createFrom().item(AUTHORIZATION_ENDPOINT);
    }

    @Override
    public Uni<IdpIdentity> exchangeCode(IdpSettings idp, String code, String codeVerifier, String redirectUri) {
        final var identity = IDENTITIES.get(code);
        if (identity == null) {
            return Uni.createFrom().failure(new UpstreamRejectedException("Unknown authorization code"));
        }
        return Uni.createFrom().item(identity);
    }
}
