package gridauth.core.model.flow;

/**
 * Token request of the authorization-code grant.
 */
public record AuthorizationCodeGrant(String code, String clientId, String redirectUri, String codeVerifier) {}
