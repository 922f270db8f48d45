package gridauth.core.model.flow;

import java.time.Duration;

/**
 * Result of starting a device flow (RFC 8628 device authorization response).
 *
 * @param deviceCode              secret polled by the device
 * @param userCode                code the user types on the verification page
 * @param verificationUri         verification page
 * @param verificationUriComplete verification page with the user code pre-filled
 * @param pollInterval            minimum interval between polls
 * @param expiresIn               lifetime of the flow
 */
public record DeviceFlowStart(
        String deviceCode,
        String userCode,
        String verificationUri,
        String verificationUriComplete,
        Duration pollInterval,
        Duration expiresIn) {}
