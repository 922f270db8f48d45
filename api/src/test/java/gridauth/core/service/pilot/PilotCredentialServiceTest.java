package gridauth.core.service.pilot;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.VerifiedToken;
import gridauth.core.model.pilot.JobAssignment;
import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.JobOutcome;
import gridauth.core.model.pilot.MatchedJob;
import gridauth.core.model.pilot.PilotLogin;
import gridauth.core.model.pilot.PilotSecretRequest;
import gridauth.fixture.AuthFixture;

@DisplayName("PilotCredentialService")
class PilotCredentialServiceTest {

    private static final String STAMP = "pilot-0001";
    private static final JobMatchRequest ANY_SITE = new JobMatchRequest("LCG.CERN.ch", null, Set.of());

    private AuthFixture fixture;
    private PilotCredentialService service;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = fixture.pilotCredentials;
    }

    private String issueSecret() {
        return fixture.pilotSecretService
                .issueSecrets(new PilotSecretRequest(1, AuthFixture.VO, 1, null, null, null))
                .await()
                .indefinitely()
                .get(0)
                .secret();
    }

    private IssuedTokens login() {
        return service.consumePilotSecret(new PilotLogin(issueSecret(), STAMP, "LCG.CERN.ch"))
                .await()
                .indefinitely();
    }

    private VerifiedToken pilotToken() {
        return fixture.verifier.verify(login().accessToken());
    }

    private JobAssignment match(VerifiedToken pilot, String jobId) {
        fixture.jobQueue.submit(new MatchedJob(jobId, AuthFixture.VO, "bob-sub", AuthFixture.USER_GROUP, Map.of()));
        return service.matchJob(pilot, ANY_SITE).await().indefinitely().orElseThrow();
    }

    @Nested
    @DisplayName("consumePilotSecret()")
    class ConsumeTests {

        @Test
        @DisplayName("should issue a pilot credential with only the pilot capability")
        void shouldIssuePilotCredential() {
            final var tokens = login();

            final var token = fixture.verifier.verify(tokens.accessToken());
            assertEquals(List.of("GenericPilot"), token.properties());
            assertEquals(STAMP, token.pilotStamp());
            assertEquals("gridvo:" + STAMP, token.subject());
            assertNull(token.group());
            assertTrue(tokens.hasRefreshToken());
        }

        @Test
        @DisplayName("should refuse a second login with a single-use secret")
        void shouldRefuseSecondLogin() {
            final var secret = issueSecret();
            service.consumePilotSecret(new PilotLogin(secret, STAMP, null)).await().indefinitely();

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.consumePilotSecret(new PilotLogin(secret, STAMP, null)).await().indefinitely());
        }

        @Test
        @DisplayName("should require a pilot stamp")
        void shouldRequireStamp() {
            assertThrows(
                    InvalidRequestException.class,
                    () -> service.consumePilotSecret(new PilotLogin(issueSecret(), " ", null))
                            .await()
                            .indefinitely());
        }
    }

    @Nested
    @DisplayName("refreshPilotCredential()")
    class RefreshTests {

        @Test
        @DisplayName("should rotate with the matching stamp")
        void shouldRotateWithStamp() {
            final var tokens = login();

            final var refreshed = service.refreshPilotCredential(tokens.refreshToken(), STAMP).await().indefinitely();

            final var token = fixture.verifier.verify(refreshed.accessToken());
            assertEquals(List.of("GenericPilot"), token.properties());
            assertEquals(STAMP, token.pilotStamp());
        }

        @Test
        @DisplayName("should refuse another stamp")
        void shouldRefuseOtherStamp() {
            final var tokens = login();

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> service.refreshPilotCredential(tokens.refreshToken(), "pilot-9999")
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should refuse a pilot token on the user refresh path")
        void shouldRefuseUserPath() {
            final var tokens = login();

            assertThrows(
                    ExpiredOrConsumedException.class,
                    () -> fixture.refreshTokens.refresh(tokens.refreshToken()).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("matchJob()")
    class MatchTests {

        @Test
        @DisplayName("should issue a job credential bound to the job")
        void shouldIssueJobCredential() {
            final var assignment = match(pilotToken(), "job-1");

            assertEquals("job-1", assignment.job().jobId());
            final var job = fixture.verifier.verify(assignment.credential().accessToken());
            assertEquals(List.of("JobExecution"), job.properties());
            assertEquals("job-1", job.jobId());
            assertEquals(STAMP, job.pilotStamp());
            assertEquals("gridvo:bob-sub", job.subject());
            assertNull(assignment.credential().refreshToken());
            assertDoesNotThrow(() -> service.authorizeJobCredential(assignment.credential().accessToken(), "job-1")
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should return empty when nothing fits")
        void shouldReturnEmpty() {
            assertTrue(service.matchJob(pilotToken(), ANY_SITE).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should refuse callers without the pilot capability")
        void shouldRefuseNonPilots() {
            final var assignment = match(pilotToken(), "job-1");
            final var jobToken = fixture.verifier.verify(assignment.credential().accessToken());

            assertThrows(
                    PermissionDeniedException.class,
                    () -> service.matchJob(jobToken, ANY_SITE).await().indefinitely());
        }

        @Test
        @DisplayName("should supersede the previous job credential of the pilot")
        void shouldSupersedePreviousCredential() {
            final var pilot = pilotToken();
            final var first = match(pilot, "job-1");

            match(pilot, "job-2");

            assertThrows(
                    InvalidTokenException.class,
                    () -> service.authorizeJobCredential(first.credential().accessToken(), "job-1")
                            .await()
                            .indefinitely());
        }
    }

    @Nested
    @DisplayName("finalizeJob()")
    class FinalizeTests {

        @Test
        @DisplayName("should revoke the job credential and be idempotent")
        void shouldRevokeIdempotently() {
            final var pilot = pilotToken();
            final var assignment = match(pilot, "job-1");
            final var raw = assignment.credential().accessToken();

            service.finalizeJob(pilot, "job-1", JobOutcome.SUCCEEDED).await().indefinitely();
            service.finalizeJob(pilot, "job-1", JobOutcome.SUCCEEDED).await().indefinitely();

            assertThrows(
                    InvalidTokenException.class,
                    () -> service.authorizeJobCredential(raw, "job-1").await().indefinitely());
        }

        @Test
        @DisplayName("should accept the job credential as caller")
        void shouldAcceptJobCredential() {
            final var assignment = match(pilotToken(), "job-1");
            final var raw = assignment.credential().accessToken();
            final var jobToken = service.authorizeJobCredential(raw, "job-1").await().indefinitely();

            service.finalizeJob(jobToken, "job-1", JobOutcome.FAILED).await().indefinitely();

            assertThrows(
                    InvalidTokenException.class,
                    () -> service.authorizeJobCredential(raw, "job-1").await().indefinitely());
        }

        @Test
        @DisplayName("should accept finalizing an unknown job")
        void shouldAcceptUnknownJob() {
            final var pilot = pilotToken();

            assertDoesNotThrow(
                    () -> service.finalizeJob(pilot, "job-404", JobOutcome.FAILED).await().indefinitely());
        }

        @Test
        @DisplayName("should refuse a job held by another pilot and leave its credential live")
        void shouldRefuseForeignJob() {
            final var holder = pilotToken();
            final var assignment = match(holder, "job-1");
            final var other = fixture.verifier.verify(service
                    .consumePilotSecret(new PilotLogin(issueSecret(), "pilot-0002", "LCG.CERN.ch"))
                    .await()
                    .indefinitely()
                    .accessToken());

            assertThrows(
                    PermissionDeniedException.class,
                    () -> service.finalizeJob(other, "job-1", JobOutcome.KILLED).await().indefinitely());
            assertDoesNotThrow(() -> service.authorizeJobCredential(assignment.credential().accessToken(), "job-1")
                    .await()
                    .indefinitely());
        }
    }

    @Test
    @DisplayName("authorizeJobCredential() should refuse a credential of another job")
    void authorizeShouldCheckJobId() {
        final var assignment = match(pilotToken(), "job-1");

        assertThrows(
                PermissionDeniedException.class,
                () -> service.authorizeJobCredential(assignment.credential().accessToken(), "job-2")
                        .await()
                        .indefinitely());
    }
}
