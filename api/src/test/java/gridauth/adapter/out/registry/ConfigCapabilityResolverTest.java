package gridauth.adapter.out.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gridauth.core.config.RegistryConfig;

@DisplayName("ConfigCapabilityResolver")
class ConfigCapabilityResolverTest {

    private RegistryConfig config;
    private RegistryConfig.Vo vo;
    private RegistryConfig.Group userGroup;

    @BeforeEach
    void setUp() {
        config = mock(RegistryConfig.class);
        vo = mock(RegistryConfig.Vo.class);
        userGroup = mock(RegistryConfig.Group.class);
        final var idp = mock(RegistryConfig.Idp.class);

        when(config.availableProperties()).thenReturn(List.of("NormalUser", "GenericPilot"));
        when(config.vos()).thenReturn(Map.of("gridvo", vo));
        when(vo.defaultGroup()).thenReturn("gridvo_user");
        when(vo.idp()).thenReturn(idp);
        when(vo.users()).thenReturn(Map.of("alice-sub", "alice"));
        when(vo.groups()).thenReturn(Map.of("gridvo_user", userGroup));
        when(userGroup.properties()).thenReturn(Optional.of(List.of("NormalUser")));
        when(userGroup.members()).thenReturn(Optional.of(List.of("alice-sub")));
        when(idp.serverMetadataUrl()).thenReturn("http://idp.test/.well-known/openid-configuration");
        when(idp.clientId()).thenReturn("gridvo-idp-client");
        when(idp.clientSecret()).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("should expose VOs with their groups, members and users")
    void shouldExposeVos() {
        final var resolver = new ConfigCapabilityResolver(config);

        final var settings = resolver.vo("gridvo").orElseThrow();
        final var group = settings.group("gridvo_user").orElseThrow();

        assertEquals(Set.of("NormalUser"), group.properties());
        assertTrue(group.isMember("alice-sub"));
        assertEquals("alice-sub", settings.subjectFor("alice").orElseThrow());
        assertEquals("gridvo-idp-client", settings.idp().clientId());
        assertTrue(resolver.vo("othervo").isEmpty());
        assertEquals(Set.of("NormalUser", "GenericPilot"), resolver.availableProperties());
    }

    @Test
    @DisplayName("should fail fast when the default group is missing")
    void shouldFailOnMissingDefaultGroup() {
        when(vo.defaultGroup()).thenReturn("gridvo_missing");

        assertThrows(IllegalStateException.class, () -> new ConfigCapabilityResolver(config));
    }

    @Test
    @DisplayName("should fail fast when a group grants an unknown property")
    void shouldFailOnUnknownProperty() {
        when(userGroup.properties()).thenReturn(Optional.of(List.of("Wizard")));

        assertThrows(IllegalStateException.class, () -> new ConfigCapabilityResolver(config));
    }

    @Test
    @DisplayName("should treat absent properties and members as empty")
    void shouldTreatAbsentAsEmpty() {
        when(userGroup.properties()).thenReturn(Optional.empty());
        when(userGroup.members()).thenReturn(Optional.empty());

        final var group = new ConfigCapabilityResolver(config).vo("gridvo").orElseThrow().group("gridvo_user").orElseThrow();

        assertTrue(group.properties().isEmpty());
        assertTrue(group.members().isEmpty());
    }
}
