package gridauth.core.model.auth;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A scope request checked against the VO registry.
 *
 * @param vo         the single requested VO
 * @param group      the group (explicit or the VO default); null for pilot scopes
 * @param properties the capabilities to embed, sorted and without duplicates
 */
public record ResolvedScope(String vo, String group, List<String> properties) {

    public ResolvedScope {
        Objects.requireNonNull(vo, "vo is required");
        properties = properties == null
                ? List.of()
                : properties.stream().distinct().sorted().toList();
    }

    /**
     * Canonical scope string, e.g. {@code vo:lhcb group:lhcb_user property:NormalUser}.
     */
    public String toScopeString() {
        return Stream.concat(
                        Stream.of("vo:" + vo),
                        Stream.concat(
                                group != null ? Stream.of("group:" + group) : Stream.empty(),
                                properties.stream().map(p -> "property:" + p)))
                .collect(Collectors.joining(" "));
    }
}
