package gridauth.core.model.flow;

import java.util.Objects;

/**
 * The part of a verified IdP ID token that is kept with a flow.
 *
 * @param issuer            IdP issuer
 * @param subject           IdP subject
 * @param preferredUsername preferred username claim, may be null
 */
public record IdpIdentity(String issuer, String subject, String preferredUsername) {

    public IdpIdentity {
        Objects.requireNonNull(subject, "subject is required");
    }
}
