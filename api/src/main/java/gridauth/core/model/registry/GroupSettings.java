package gridauth.core.model.registry;

import java.util.Set;

/**
 * Capabilities and members of one group.
 *
 * @param name       group name
 * @param properties capabilities granted by the group
 * @param members    IdP subjects allowed to select the group
 */
public record GroupSettings(String name, Set<String> properties, Set<String> members) {

    public GroupSettings {
        properties = properties != null ? Set.copyOf(properties) : Set.of();
        members = members != null ? Set.copyOf(members) : Set.of();
    }

    public boolean isMember(String subject) {
        return members.contains(subject);
    }
}
