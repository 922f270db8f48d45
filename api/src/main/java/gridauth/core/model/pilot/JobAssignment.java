package gridauth.core.model.pilot;

import gridauth.core.model.auth.IssuedTokens;

/**
 * A matched job together with the credential scoped to it.
 */
public record JobAssignment(MatchedJob job, IssuedTokens credential) {}
