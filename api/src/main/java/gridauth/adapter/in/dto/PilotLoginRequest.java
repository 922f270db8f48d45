package gridauth.adapter.in.dto;

import gridauth.core.model.pilot.PilotLogin;

/**
 * Pilot secret exchange request.
 *
 * @param pilotSecret plaintext secret handed to the pilot at submission
 * @param pilotStamp  stamp identifying the pilot (required)
 * @param site        site the pilot runs at, checked against the secret's site constraint
 */
public record PilotLoginRequest(String pilotSecret, String pilotStamp, String site) {

    public PilotLogin toLogin() {
        return new PilotLogin(pilotSecret, pilotStamp, site);
    }
}
