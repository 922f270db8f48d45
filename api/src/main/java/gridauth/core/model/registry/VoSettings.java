package gridauth.core.model.registry;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one virtual organization.
 *
 * @param name         VO name
 * @param defaultGroup group used when a scope names none
 * @param idp          IdP used by the interactive flows
 * @param users        IdP subject to preferred username
 * @param groups       groups by name
 */
public record VoSettings(
        String name, String defaultGroup, IdpSettings idp, Map<String, String> users, Map<String, GroupSettings> groups) {

    public VoSettings {
        users = users != null ? Map.copyOf(users) : Map.of();
        groups = groups != null ? Map.copyOf(groups) : Map.of();
    }

    public Optional<GroupSettings> group(String groupName) {
        return Optional.ofNullable(groups.get(groupName));
    }

    /**
     * Reverse lookup of a subject by its preferred username.
     */
    public Optional<String> subjectFor(String preferredUsername) {
        return users.entrySet().stream()
                .filter(e -> e.getValue().equals(preferredUsername))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
