package gridauth.core.model.flow;

/**
 * Token request of the device-code grant.
 */
public record DeviceCodeGrant(String deviceCode, String clientId, String codeVerifier) {}
