package gridauth.adapter.in.dto;

/**
 * Pilot refresh request. The stamp must match the one the refresh token was issued to.
 */
public record PilotRefreshRequest(String refreshToken, String pilotStamp) {}
