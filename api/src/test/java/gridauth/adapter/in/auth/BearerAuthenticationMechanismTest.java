package gridauth.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.quarkus.security.identity.IdentityProviderManager;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.identity.request.AuthenticationRequest;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("BearerAuthenticationMechanism")
class BearerAuthenticationMechanismTest {

    private BearerAuthenticationMechanism mechanism;
    private IdentityProviderManager identityProviderManager;
    private RoutingContext routingContext;
    private HttpServerRequest httpRequest;

    @BeforeEach
    void setUp() {
        identityProviderManager = mock(IdentityProviderManager.class);
        routingContext = mock(RoutingContext.class);
        httpRequest = mock(HttpServerRequest.class);

        when(routingContext.request()).thenReturn(httpRequest);
        when(httpRequest.path()).thenReturn("/api/auth/userinfo");

        mechanism = new BearerAuthenticationMechanism();
    }

    private SecurityIdentity authenticate() {
        return mechanism
                .authenticate(routingContext, identityProviderManager)
                .await()
                .indefinitely();
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should return null when no Authorization header")
        void shouldReturnNullWithoutHeader() {
            when(httpRequest.getHeader("Authorization")).thenReturn(null);

            assertNull(authenticate());
            verify(identityProviderManager, never()).authenticate(any());
        }

        @Test
        @DisplayName("should return null for a non-bearer scheme")
        void shouldReturnNullForOtherScheme() {
            when(httpRequest.getHeader("Authorization")).thenReturn("Basic dXNlcjpwYXNz");

            assertNull(authenticate());
            verify(identityProviderManager, never()).authenticate(any());
        }

        @Test
        @DisplayName("should leave the legacy exchange key to its endpoint")
        void shouldIgnoreLegacyKey() {
            when(httpRequest.getHeader("Authorization")).thenReturn("Bearer diracx:legacy:c2VjcmV0");

            assertNull(authenticate());
            verify(identityProviderManager, never()).authenticate(any());
        }

        @Test
        @DisplayName("should hand the token to the identity provider")
        void shouldDelegateToken() {
            final var identity = mock(SecurityIdentity.class);
            when(httpRequest.getHeader("Authorization")).thenReturn("Bearer eyJhbGciOiJSUzI1NiJ9.e30.sig");
            when(identityProviderManager.authenticate(any())).thenReturn(Uni.createFrom().item(identity));

            final var result = authenticate();

            final ArgumentCaptor<AuthenticationRequest> captor = ArgumentCaptor.forClass(AuthenticationRequest.class);
            verify(identityProviderManager).authenticate(captor.capture());
            assertEquals(identity, result);
            assertEquals(
                    "eyJhbGciOiJSUzI1NiJ9.e30.sig", ((BearerAuthenticationRequest) captor.getValue()).getToken());
        }
    }

    @Test
    @DisplayName("challenge should be a 401 with a Bearer realm")
    void challengeShouldBeBearer() {
        final var challenge = mechanism.getChallenge(routingContext).await().indefinitely();

        assertEquals(401, challenge.status);
        assertEquals("WWW-Authenticate", challenge.headerName.toString());
    }
}
