package gridauth.adapter.in.auth;

import java.security.Principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.exception.AuthException;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.service.auth.TokenVerifier;
import gridauth.core.service.pilot.PilotCredentialService;

/**
 * Quarkus identity provider for access tokens minted by this server.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal name: the VO-qualified subject</li>
 *   <li>Roles: the token's {@code dirac_properties}</li>
 *   <li>Attribute {@value #TOKEN_ATTRIBUTE}: the {@link VerifiedToken}</li>
 * </ul>
 *
 * <p>Job credentials are only accepted while the job they are bound to is not finalized.
 */
@ApplicationScoped
public class BearerIdentityProvider implements IdentityProvider<BearerAuthenticationRequest> {

    public static final String TOKEN_ATTRIBUTE = "token";

    private static final Logger LOG = Logger.getLogger(BearerIdentityProvider.class);

    private final TokenVerifier verifier;
    private final PilotCredentialService pilotCredentials;

    @Inject
    public BearerIdentityProvider(TokenVerifier verifier, PilotCredentialService pilotCredentials) {
        this.verifier = verifier;
        this.pilotCredentials = pilotCredentials;
    }

    @Override
    public Class<BearerAuthenticationRequest> getRequestType() {
        return BearerAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BearerAuthenticationRequest request, AuthenticationRequestContext context) {
        return Uni.createFrom()
                .<VerifiedToken>deferred(() -> {
                    final var token = verifier.verify(request.getToken());
                    return token.isJobCredential()
                            ? pilotCredentials.checkJobCredential(token)
                            : Uni.createFrom().item(token);
                })
                .map(BearerIdentityProvider::buildIdentity)
                .onFailure(AuthException.class)
                .transform(e -> {
                    LOG.debugv("Bearer authentication failed: {0}", e.getMessage());
                    return new AuthenticationFailedException(e.getMessage(), e);
                });
    }

    static SecurityIdentity buildIdentity(VerifiedToken token) {
        final var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(new TokenPrincipal(token.subject()))
                .addAttribute(TOKEN_ATTRIBUTE, token)
                .addAttribute("vo", token.vo());
        token.properties().forEach(builder::addRole);
        LOG.debugv("Bearer authenticated: subject={0}, properties={1}", token.subject(), token.properties());
        return builder.build();
    }

    /**
     * Principal named by the VO-qualified subject of the token.
     */
    public record TokenPrincipal(String name) implements Principal {

        @Override
        public String getName() {
            return name;
        }
    }
}
