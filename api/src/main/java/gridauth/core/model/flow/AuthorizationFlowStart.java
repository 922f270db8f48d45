package gridauth.core.model.flow;

/**
 * Result of starting an authorization-code flow.
 *
 * @param flowId         opaque flow id
 * @param idpRedirectUrl where to send the user agent
 */
public record AuthorizationFlowStart(String flowId, String idpRedirectUrl) {}
