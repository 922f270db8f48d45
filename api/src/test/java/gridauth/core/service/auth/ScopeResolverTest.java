package gridauth.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.fixture.AuthFixture;

@DisplayName("ScopeResolver")
class ScopeResolverTest {

    private final ScopeResolver resolver = new ScopeResolver(new AuthFixture.StaticCapabilityResolver());

    @Nested
    @DisplayName("parse()")
    class ParseTests {

        @Test
        @DisplayName("should split vo, group and property tokens")
        void shouldSplitTokens() {
            final var parsed = ScopeResolver.parse("vo:gridvo  group:gridvo_admin property:NormalUser property:NormalUser");

            assertEquals("gridvo", parsed.vo());
            assertEquals("gridvo_admin", parsed.group().orElseThrow());
            assertEquals(List.of("NormalUser"), parsed.properties());
        }

        @Test
        @DisplayName("should reject a scope without a VO")
        void shouldRejectMissingVo() {
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse("group:gridvo_user"));
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse(" "));
        }

        @Test
        @DisplayName("should reject two VOs")
        void shouldRejectTwoVos() {
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse("vo:a vo:b"));
        }

        @Test
        @DisplayName("should reject two groups")
        void shouldRejectTwoGroups() {
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse("vo:a group:x group:y"));
        }

        @Test
        @DisplayName("should reject unknown and empty tokens")
        void shouldRejectUnknownTokens() {
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse("vo:gridvo openid"));
            assertThrows(InvalidRequestException.class, () -> ScopeResolver.parse("vo:gridvo property:"));
        }
    }

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("should fall back to the default group and all its properties")
        void shouldUseDefaultGroup() {
            final var scope = resolver.resolve("vo:gridvo", AuthFixture.BOB);

            assertEquals("gridvo", scope.vo());
            assertEquals(AuthFixture.USER_GROUP, scope.group());
            assertEquals(List.of("NormalUser"), scope.properties());
        }

        @Test
        @DisplayName("should grant exactly the requested subset")
        void shouldGrantRequestedSubset() {
            final var scope =
                    resolver.resolve("vo:gridvo group:gridvo_admin property:ServiceAdministrator", AuthFixture.ALICE);

            assertEquals(List.of("ServiceAdministrator"), scope.properties());
            assertEquals(
                    "vo:gridvo group:gridvo_admin property:ServiceAdministrator", scope.toScopeString());
        }

        @Test
        @DisplayName("should sort granted properties")
        void shouldSortProperties() {
            final var scope = resolver.resolve("vo:gridvo group:gridvo_admin", AuthFixture.ALICE);

            assertEquals(List.of("NormalUser", "ServiceAdministrator"), scope.properties());
        }

        @Test
        @DisplayName("should deny a property outside the group's set")
        void shouldDenyForeignProperty() {
            assertThrows(
                    PermissionDeniedException.class,
                    () -> resolver.resolve("vo:gridvo property:ServiceAdministrator", AuthFixture.BOB));
        }

        @Test
        @DisplayName("should deny a subject that is not a member")
        void shouldDenyNonMember() {
            assertThrows(
                    PermissionDeniedException.class,
                    () -> resolver.resolve("vo:gridvo group:gridvo_admin", AuthFixture.BOB));
        }

        @Test
        @DisplayName("should skip the membership check without a subject")
        void shouldSkipMembershipWithoutSubject() {
            final var scope = resolver.resolve("vo:gridvo group:gridvo_admin");

            assertEquals(AuthFixture.ADMIN_GROUP, scope.group());
        }

        @Test
        @DisplayName("should reject unknown VOs, groups and properties as malformed")
        void shouldRejectUnknownEntries() {
            assertThrows(InvalidRequestException.class, () -> resolver.resolve("vo:othervo"));
            assertThrows(InvalidRequestException.class, () -> resolver.resolve("vo:gridvo group:nope"));
            assertThrows(InvalidRequestException.class, () -> resolver.resolve("vo:gridvo property:Wizard"));
        }
    }

    @Test
    @DisplayName("requireVo() should return the VO settings or fail")
    void shouldRequireVo() {
        assertEquals(AuthFixture.USER_GROUP, resolver.requireVo("gridvo").defaultGroup());
        assertThrows(InvalidRequestException.class, () -> resolver.requireVo("othervo"));
        assertNull(resolver.requireVo("gridvo").idp().clientSecret().orElse(null));
    }
}
