package gridauth.adapter.in.dto;

import gridauth.core.model.flow.DeviceFlowStart;

/**
 * Device authorization response (RFC 8628 section 3.2).
 */
public record DeviceAuthorizationResponse(
        String deviceCode,
        String userCode,
        String verificationUri,
        String verificationUriComplete,
        long expiresIn,
        long interval) {

    public static DeviceAuthorizationResponse from(DeviceFlowStart start) {
        return new DeviceAuthorizationResponse(
                start.deviceCode(),
                start.userCode(),
                start.verificationUri(),
                start.verificationUriComplete(),
                start.expiresIn().getSeconds(),
                start.pollInterval().getSeconds());
    }
}
