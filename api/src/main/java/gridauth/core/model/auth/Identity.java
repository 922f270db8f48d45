package gridauth.core.model.auth;

import java.util.Objects;

/**
 * Who a token is issued to, resolved once per issuance and embedded in the token.
 *
 * @param subject           the subject asserted by the IdP (or the pilot stamp for pilots)
 * @param vo                virtual organization
 * @param group             selected group, null for pilot and job credentials
 * @param preferredUsername human-readable name, may be null
 */
public record Identity(String subject, String vo, String group, String preferredUsername) {

    public Identity {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(vo, "vo is required");
    }

    /**
     * VO-qualified principal used as the token {@code sub} claim.
     */
    public String principal() {
        return vo + ":" + subject;
    }

    /**
     * Split a VO-qualified principal back into its parts.
     *
     * @throws IllegalArgumentException if the principal has no VO prefix
     */
    public static String[] splitPrincipal(String principal) {
        final var idx = principal == null ? -1 : principal.indexOf(':');
        if (idx <= 0 || idx == principal.length() - 1) {
            throw new IllegalArgumentException("Principal is not VO-qualified: " + principal);
        }
        return new String[] {principal.substring(0, idx), principal.substring(idx + 1)};
    }
}
