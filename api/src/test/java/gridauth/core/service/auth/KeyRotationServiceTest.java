package gridauth.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.exception.InvalidTokenException;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.auth.SigningKeyRecord;
import gridauth.fixture.AuthFixture;

@DisplayName("KeyRotationService")
class KeyRotationServiceTest {

    private AuthFixture fixture;
    private KeyRotationService service;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = new KeyRotationService(
                fixture.keyRegistry,
                fixture.keyRepository,
                fixture.keyConfig,
                fixture.tokenConfig,
                fixture.pilotConfig,
                fixture.legacyConfig);
    }

    private String mintUserToken() {
        final var identity = new Identity(AuthFixture.BOB, AuthFixture.VO, AuthFixture.USER_GROUP, "bob");
        final var scope = new ResolvedScope(AuthFixture.VO, AuthFixture.USER_GROUP, List.of("NormalUser"));
        return fixture.issuer.mint(identity, scope, LifetimeClass.USER).token();
    }

    @Test
    @DisplayName("retirementWindow() should cover the longest token lifetime plus clock skew")
    void retirementWindowShouldCoverLongestLifetime() {
        assertEquals(Duration.ofHours(6).plusSeconds(30), service.retirementWindow());
    }

    @Nested
    @DisplayName("rotateKeys()")
    class RotateKeysTests {

        @Test
        @DisplayName("should return the new key without private material")
        void shouldHidePrivateKey() {
            final var previous = fixture.keyRegistry.currentSigningKey().keyId();

            final var rotated = service.rotateKeys().await().indefinitely();

            assertNotEquals(previous, rotated.keyId());
            assertNull(rotated.privateKey());
            assertEquals(KeyStatus.ACTIVE, rotated.status());
        }

        @Test
        @DisplayName("should activate a supplied private key under the given id")
        void shouldActivateSuppliedKey() {
            final var supplied = fixture.keyRegistry.generateKey().await().indefinitely();

            final var rotated = service.rotateKeys("k-imported", supplied.privateKey()).await().indefinitely();

            assertEquals("k-imported", rotated.keyId());
            assertEquals("k-imported", fixture.keyRegistry.currentSigningKey().keyId());
            assertEquals(supplied.publicKey(), fixture.keyRegistry.currentSigningKey().publicKey());
        }
    }

    @Nested
    @DisplayName("processKeyLifecycle()")
    class LifecycleTests {

        @Test
        @DisplayName("should revoke RETIRING keys past the retirement window")
        void shouldRevokeOldRetiringKeys() {
            final var generated = fixture.keyRegistry.generateKey().await().indefinitely();
            final var stale = SigningKeyRecord.active(
                            "k-stale", generated.privateKey(), generated.publicKey(), Instant.now().minus(Duration.ofDays(2)))
                    .retire(Instant.now().minus(Duration.ofHours(7)));
            fixture.keyRepository.store(stale).await().indefinitely();
            fixture.keyRegistry.refresh().await().indefinitely();
            assertTrue(fixture.keyRegistry.verificationKey("k-stale").isPresent());

            service.processKeyLifecycle().await().indefinitely();

            assertEquals(KeyStatus.REVOKED, service.getKey("k-stale").await().indefinitely().status());
            assertTrue(fixture.keyRegistry.verificationKey("k-stale").isEmpty());
        }

        @Test
        @DisplayName("should keep recently retired keys verifying")
        void shouldKeepRecentRetiringKeys() {
            final var token = mintUserToken();
            service.rotateKeys().await().indefinitely();

            service.processKeyLifecycle().await().indefinitely();

            assertEquals("gridvo:bob-sub", fixture.verifier.verify(token).subject());
        }

        @Test
        @DisplayName("should delete REVOKED keys past the retention period")
        void shouldDeleteOldRevokedKeys() {
            final var generated = fixture.keyRegistry.generateKey().await().indefinitely();
            final var longGone = SigningKeyRecord.active(
                            "k-gone", generated.privateKey(), generated.publicKey(), Instant.now().minus(Duration.ofDays(30)))
                    .revoke(Instant.now().minus(Duration.ofDays(8)));
            fixture.keyRepository.store(longGone).await().indefinitely();

            service.processKeyLifecycle().await().indefinitely();

            assertTrue(fixture.keyRepository.findById("k-gone").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("forceRevoke()")
    class ForceRevokeTests {

        @Test
        @DisplayName("should rotate first when revoking the active key")
        void shouldRotateBeforeRevokingActive() {
            final var token = mintUserToken();
            final var active = fixture.keyRegistry.currentSigningKey().keyId();

            service.forceRevoke(active).await().indefinitely();

            assertNotEquals(active, fixture.keyRegistry.currentSigningKey().keyId());
            assertThrows(InvalidTokenException.class, () -> fixture.verifier.verify(token));
        }

        @Test
        @DisplayName("should fail for unknown keys")
        void shouldFailForUnknownKey() {
            assertThrows(
                    KeyRotationService.KeyNotFoundException.class,
                    () -> service.forceRevoke("k-missing").await().indefinitely());
        }
    }

    @Test
    @DisplayName("listKeys() should never expose private keys")
    void listKeysShouldHidePrivateKeys() {
        service.rotateKeys().await().indefinitely();

        final var keys = service.listKeys().await().indefinitely();

        assertEquals(2, keys.size());
        assertTrue(keys.stream().allMatch(k -> k.privateKey() == null));
    }
}
