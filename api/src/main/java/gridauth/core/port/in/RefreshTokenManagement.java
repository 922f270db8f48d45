package gridauth.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.RefreshTokenRecord;

/**
 * Port for the refresh token lifecycle.
 */
public interface RefreshTokenManagement {

    /**
     * Rotate a refresh token. Presenting a rotated token revokes its whole chain.
     */
    Uni<IssuedTokens> refresh(String rawRefreshToken);

    /**
     * Revoke the chain of a refresh token. Never fails on an invalid token.
     */
    Uni<Void> revoke(String rawRefreshToken);

    /**
     * Revoke every refresh token of a principal.
     *
     * @param principal VO-qualified subject ({@code vo:sub})
     * @return Uni with the number of records revoked
     */
    Uni<Integer> revokeAllForSubject(String principal);

    /**
     * Active refresh tokens of a principal.
     */
    Uni<List<RefreshTokenRecord>> listRefreshTokens(String principal);

    /**
     * Revoke one of the caller's own refresh tokens.
     */
    Uni<Void> revokeRefreshTokenById(String principal, String jti);

    Uni<Integer> purgeExpired();
}
