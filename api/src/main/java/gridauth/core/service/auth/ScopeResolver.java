package gridauth.core.service.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.registry.GroupSettings;
import gridauth.core.model.registry.VoSettings;
import gridauth.spi.CapabilityResolver;

/**
 * Resolves requested scope strings against the capability registry.
 *
 * <p>Grammar: space-separated {@code vo:<name>}, {@code group:<name>} and
 * {@code property:<name>} tokens. Exactly one {@code vo:} token is required; without a
 * {@code group:} token the VO's default group applies. Without {@code property:} tokens
 * every property of the group is granted, otherwise exactly the requested ones, which
 * must all belong to the group.
 */
@ApplicationScoped
public class ScopeResolver {

    private static final String VO_PREFIX = "vo:";
    private static final String GROUP_PREFIX = "group:";
    private static final String PROPERTY_PREFIX = "property:";

    private final CapabilityResolver capabilities;

    @Inject
    public ScopeResolver(CapabilityResolver capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Resolve a scope without checking group membership. Used when a flow starts and
     * the caller's identity is not known yet.
     *
     * @throws InvalidRequestException   if the scope is malformed or names unknown entries
     * @throws PermissionDeniedException if a requested property is outside the group's set
     */
    public ResolvedScope resolve(String scope) {
        return resolve(scope, null);
    }

    /**
     * Resolve a scope for a subject.
     *
     * @param scope   the requested scope string
     * @param subject the IdP subject, checked for group membership when not null
     * @throws InvalidRequestException   if the scope is malformed or names unknown entries
     * @throws PermissionDeniedException if the subject is not a group member or a requested
     *                                   property is outside the group's set
     */
    public ResolvedScope resolve(String scope, String subject) {
        final var parsed = parse(scope);
        final var vo = capabilities
                .vo(parsed.vo())
                .orElseThrow(() -> new InvalidRequestException("Unknown VO: " + parsed.vo()));
        final var groupName = parsed.group().orElse(vo.defaultGroup());
        final var group = vo.group(groupName)
                .orElseThrow(() -> new InvalidRequestException("Unknown group " + groupName + " in VO " + vo.name()));

        for (var property : parsed.properties()) {
            if (!capabilities.availableProperties().contains(property)) {
                throw new InvalidRequestException("Unknown property: " + property);
            }
        }

        if (subject != null && !group.isMember(subject)) {
            throw new PermissionDeniedException(subject + " is not a member of " + vo.name() + "/" + groupName);
        }

        return new ResolvedScope(vo.name(), groupName, grantedProperties(parsed, group));
    }

    /**
     * Look up a VO that must exist.
     */
    public VoSettings requireVo(String voName) {
        return capabilities.vo(voName).orElseThrow(() -> new InvalidRequestException("Unknown VO: " + voName));
    }

    private static List<String> grantedProperties(ParsedScope parsed, GroupSettings group) {
        if (parsed.properties().isEmpty()) {
            return new ArrayList<>(group.properties());
        }
        for (var property : parsed.properties()) {
            if (!group.properties().contains(property)) {
                throw new PermissionDeniedException(
                        "Property " + property + " is not granted to group " + group.name());
            }
        }
        return parsed.properties();
    }

    static ParsedScope parse(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new InvalidRequestException("Scope must name exactly one VO");
        }

        String vo = null;
        String group = null;
        final var properties = new ArrayList<String>();
        for (var token : scope.trim().split("\\s+")) {
            if (token.startsWith(VO_PREFIX)) {
                if (vo != null) {
                    throw new InvalidRequestException("Scope must name exactly one VO");
                }
                vo = value(token, VO_PREFIX);
            } else if (token.startsWith(GROUP_PREFIX)) {
                if (group != null) {
                    throw new InvalidRequestException("Scope may name at most one group");
                }
                group = value(token, GROUP_PREFIX);
            } else if (token.startsWith(PROPERTY_PREFIX)) {
                properties.add(value(token, PROPERTY_PREFIX));
            } else {
                throw new InvalidRequestException("Unrecognised scope token: " + token);
            }
        }

        if (vo == null) {
            throw new InvalidRequestException("Scope must name exactly one VO");
        }
        return new ParsedScope(vo, Optional.ofNullable(group), properties.stream().distinct().toList());
    }

    private static String value(String token, String prefix) {
        final var value = token.substring(prefix.length());
        if (value.isEmpty()) {
            throw new InvalidRequestException("Empty scope token: " + token);
        }
        return value;
    }

    record ParsedScope(String vo, Optional<String> group, List<String> properties) {}
}
