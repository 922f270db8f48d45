package gridauth.core.model.pilot;

/**
 * Credentials presented by a pilot to obtain its pilot credential.
 *
 * @param secret     plaintext pilot secret
 * @param pilotStamp stamp identifying the pilot
 * @param site       site the pilot runs at, may be null
 */
public record PilotLogin(String secret, String pilotStamp, String site) {}
