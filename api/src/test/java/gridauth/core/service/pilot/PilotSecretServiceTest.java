package gridauth.core.service.pilot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.model.pilot.IssuedPilotSecret;
import gridauth.core.model.pilot.PilotLogin;
import gridauth.core.model.pilot.PilotSecretRecord;
import gridauth.core.model.pilot.PilotSecretRequest;
import gridauth.core.util.SecureHash;
import gridauth.fixture.AuthFixture;

@DisplayName("PilotSecretService")
class PilotSecretServiceTest {

    private AuthFixture fixture;
    private PilotSecretService service;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = fixture.pilotSecretService;
    }

    private IssuedPilotSecret issueOne(int maxUses, Set<String> stamps, Set<String> sites) {
        return service.issueSecrets(new PilotSecretRequest(1, AuthFixture.VO, maxUses, null, stamps, sites))
                .await()
                .indefinitely()
                .get(0);
    }

    @Nested
    @DisplayName("issueSecrets()")
    class IssueTests {

        @Test
        @DisplayName("should store only hashes of distinct secrets")
        void shouldStoreHashes() {
            final List<IssuedPilotSecret> issued = service.issueSecrets(
                            new PilotSecretRequest(3, AuthFixture.VO, 1, Duration.ofHours(1), null, null))
                    .await()
                    .indefinitely();

            assertEquals(3, issued.size());
            assertEquals(3, issued.stream().map(IssuedPilotSecret::secret).distinct().count());
            for (var secret : issued) {
                assertTrue(fixture.pilotSecrets
                        .findByHash(SecureHash.sha256Hex(secret.secret()))
                        .await()
                        .indefinitely()
                        .isPresent());
                assertTrue(fixture.pilotSecrets
                        .findByHash(secret.secret())
                        .await()
                        .indefinitely()
                        .isEmpty());
            }
        }

        @Test
        @DisplayName("should apply the default lifetime")
        void shouldApplyDefaultLifetime() {
            final var before = Instant.now();

            final var issued = issueOne(1, null, null);

            assertTrue(issued.expiresAt().isAfter(before.plus(Duration.ofHours(23))));
        }

        @Test
        @DisplayName("should refuse an unknown VO")
        void shouldRefuseUnknownVo() {
            assertThrows(
                    InvalidRequestException.class,
                    () -> service.issueSecrets(new PilotSecretRequest(1, "othervo", 1, null, null, null))
                            .await()
                            .indefinitely());
        }
    }

    @Nested
    @DisplayName("consume()")
    class ConsumeTests {

        @Test
        @DisplayName("should allow a single-use secret exactly once")
        void shouldConsumeOnce() {
            final var secret = issueOne(1, null, null);
            final var login = new PilotLogin(secret.secret(), "pilot-1", null);

            final var record = service.consume(login).await().indefinitely();

            assertEquals(AuthFixture.VO, record.vo());
            final var ex = assertThrows(
                    ExpiredOrConsumedException.class, () -> service.consume(login).await().indefinitely());
            assertEquals(ExpiredOrConsumedException.INVALID_CLIENT, ex.getError());
            assertEquals(1.0, fixture.counter("gridauth.pilot.secrets.consumed", "result", "success"));
            assertEquals(1.0, fixture.counter("gridauth.pilot.secrets.consumed", "result", "failure"));
        }

        @Test
        @DisplayName("should count down multi-use secrets")
        void shouldCountDownUses() {
            final var secret = issueOne(2, null, null);

            service.consume(new PilotLogin(secret.secret(), "pilot-1", null)).await().indefinitely();
            service.consume(new PilotLogin(secret.secret(), "pilot-2", null)).await().indefinitely();

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin(secret.secret(), "pilot-3", null))
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should let only one of many racing pilots use a single-use secret")
        void shouldSerializeRacingPilots() throws Exception {
            final var secret = issueOne(1, null, null);
            final var executor = Executors.newFixedThreadPool(8);
            final var start = new CountDownLatch(1);
            final var successes = new AtomicInteger();
            final var failures = new AtomicInteger();
            try {
                for (var i = 0; i < 8; i++) {
                    final var stamp = "pilot-" + i;
                    executor.submit(() -> {
                        start.await();
                        try {
                            service.consume(new PilotLogin(secret.secret(), stamp, null))
                                    .await()
                                    .indefinitely();
                            successes.incrementAndGet();
                        } catch (ExpiredOrConsumedException e) {
                            failures.incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, successes.get());
            assertEquals(7, failures.get());
        }

        @Test
        @DisplayName("should enforce stamp and site constraints without using up the secret")
        void shouldEnforceConstraints() {
            final var secret = issueOne(1, Set.of("pilot-1"), Set.of("LCG.CERN.ch"));

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin(secret.secret(), "pilot-2", "LCG.CERN.ch"))
                            .await()
                            .indefinitely());
            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin(secret.secret(), "pilot-1", null))
                            .await()
                            .indefinitely());

            service.consume(new PilotLogin(secret.secret(), "pilot-1", "LCG.CERN.ch")).await().indefinitely();
        }

        @Test
        @DisplayName("should reject and remove an expired secret")
        void shouldRejectExpired() {
            final var now = Instant.now();
            final var hash = SecureHash.sha256Hex("expired-secret");
            fixture.pilotSecrets
                    .insert(new PilotSecretRecord(
                            hash, AuthFixture.VO, null, null, 1, 0, now.minusSeconds(120), now.minusSeconds(60), null))
                    .await()
                    .indefinitely();

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin("expired-secret", "pilot-1", null))
                            .await()
                            .indefinitely());
            assertTrue(fixture.pilotSecrets.findByHash(hash).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should fail unknown and missing secrets with the same message")
        void shouldFailUnknownSecrets() {
            final var unknown = assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin("nope", "pilot-1", null)).await().indefinitely());
            final var missing = assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consume(new PilotLogin(null, "pilot-1", null)).await().indefinitely());

            assertEquals(unknown.getMessage(), missing.getMessage());
            assertNotEquals("", unknown.getMessage());
        }
    }

    @Test
    @DisplayName("purgeExpiredSecrets() should remove only expired secrets")
    void purgeShouldRemoveExpired() {
        final var now = Instant.now();
        fixture.pilotSecrets
                .insert(new PilotSecretRecord(
                        "old", AuthFixture.VO, null, null, 1, 0, now.minusSeconds(120), now.minusSeconds(60), null))
                .await()
                .indefinitely();
        issueOne(1, null, null);

        assertEquals(1, service.purgeExpiredSecrets().await().indefinitely());
    }
}
