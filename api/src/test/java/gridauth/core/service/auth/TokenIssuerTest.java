package gridauth.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.RefreshTokenStatus;
import gridauth.core.model.auth.ResolvedScope;
import gridauth.core.model.auth.TokenClaims;
import gridauth.core.model.auth.TokenExtras;
import gridauth.fixture.AuthFixture;

@DisplayName("TokenIssuer")
class TokenIssuerTest {

    private AuthFixture fixture;
    private Identity alice;
    private ResolvedScope adminScope;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        alice = new Identity(AuthFixture.ALICE, AuthFixture.VO, AuthFixture.ADMIN_GROUP, "alice");
        adminScope = new ResolvedScope(
                AuthFixture.VO, AuthFixture.ADMIN_GROUP, List.of("ServiceAdministrator", "NormalUser"));
    }

    @Nested
    @DisplayName("mint()")
    class MintTests {

        @Test
        @DisplayName("should embed exactly the resolved properties")
        void shouldEmbedExactProperties() {
            final var signed = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);

            final var verified = fixture.verifier.verify(signed.token());

            assertEquals(List.of("NormalUser", "ServiceAdministrator"), verified.properties());
            assertEquals("gridvo:alice-sub", verified.subject());
            assertEquals(AuthFixture.VO, verified.vo());
            assertEquals(AuthFixture.ADMIN_GROUP, verified.group());
            assertEquals("alice", verified.preferredUsername());
            assertEquals(signed.jti(), verified.jti());
            assertFalse(verified.legacyExchange());
        }

        @Test
        @DisplayName("should carry the active key id in the header")
        void shouldCarryKeyId() {
            final var signed = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);

            final var verified = fixture.verifier.verify(signed.token());

            assertEquals(fixture.keyRegistry.currentSigningKey().keyId(), verified.keyId());
        }

        @Test
        @DisplayName("should set iss, aud and typ")
        void shouldSetStandardClaims() throws Exception {
            final var signed = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);

            final var claims = new JwtConsumerBuilder()
                    .setVerificationKey(fixture.keyRegistry.currentSigningKey().publicKey())
                    .setExpectedAudience(AuthFixture.AUDIENCE)
                    .build()
                    .processToClaims(signed.token());

            assertEquals(AuthFixture.ISSUER, claims.getIssuer());
            assertEquals(TokenClaims.TYPE_ACCESS, claims.getStringClaimValue(TokenClaims.TOKEN_TYPE));
        }

        @Test
        @DisplayName("should apply the lifetime of the lifetime class")
        void shouldApplyLifetimeClass() {
            final var before = Instant.now();

            final var user = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);
            final var job = fixture.issuer.mint(alice, adminScope, LifetimeClass.JOB);

            assertTrue(user.expiresAt().isBefore(before.plus(Duration.ofMinutes(21))));
            assertTrue(job.expiresAt().isAfter(before.plus(Duration.ofMinutes(59))));
        }

        @Test
        @DisplayName("should honor a lifetime override and the legacy marker")
        void shouldHonorOverride() {
            final var before = Instant.now();

            final var signed =
                    fixture.issuer.mint(alice, adminScope, LifetimeClass.USER, TokenExtras.legacy(Duration.ofMinutes(2)));

            assertTrue(signed.expiresAt().isBefore(before.plus(Duration.ofMinutes(3))));
            assertTrue(fixture.verifier.verify(signed.token()).legacyExchange());
        }

        @Test
        @DisplayName("should embed pilot stamp and job id for job credentials")
        void shouldEmbedJobClaims() {
            final var signed = fixture.issuer.mint(
                    alice, adminScope, LifetimeClass.JOB, TokenExtras.job("pilot-1", "job-42"));

            final var verified = fixture.verifier.verify(signed.token());

            assertEquals("pilot-1", verified.pilotStamp());
            assertEquals("job-42", verified.jobId());
            assertTrue(verified.isJobCredential());
        }

        @Test
        @DisplayName("should give every token a fresh jti")
        void shouldUseFreshJti() {
            final var first = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);
            final var second = fixture.issuer.mint(alice, adminScope, LifetimeClass.USER);

            assertNotEquals(first.jti(), second.jti());
        }
    }

    @Nested
    @DisplayName("issue()")
    class IssueTests {

        @Test
        @DisplayName("should persist a refresh record as the root of a new chain")
        void shouldPersistRefreshRoot() {
            final var tokens = fixture.issuer
                    .issue(alice, adminScope, LifetimeClass.USER, CredentialKind.USER, TokenExtras.NONE)
                    .await()
                    .indefinitely();

            assertTrue(tokens.hasRefreshToken());
            final var jti = fixture.verifier.verifyRefreshHandle(tokens.refreshToken());
            final var record = fixture.refreshTokenRepository
                    .findByJti(jti)
                    .await()
                    .indefinitely()
                    .orElseThrow();

            assertEquals(jti, record.rootJti());
            assertNull(record.parentJti());
            assertEquals(RefreshTokenStatus.ACTIVE, record.status());
            assertEquals("gridvo:alice-sub", record.subject());
            assertEquals(adminScope.toScopeString(), record.scope());
            assertNotNull(tokens.accessJti());
        }

        @Test
        @DisplayName("should use the pilot refresh lifetime for pilot credentials")
        void shouldUsePilotRefreshLifetime() {
            final var pilot = new Identity("pilot-1", AuthFixture.VO, null, null);
            final var scope = new ResolvedScope(AuthFixture.VO, null, List.of("GenericPilot"));
            final var before = Instant.now();

            final var tokens = fixture.issuer
                    .issue(pilot, scope, LifetimeClass.PILOT, CredentialKind.PILOT, TokenExtras.pilot("pilot-1"))
                    .await()
                    .indefinitely();

            assertTrue(tokens.refreshExpiresAt().isAfter(before.plus(Duration.ofHours(5))));
        }
    }
}
