package gridauth.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.exception.ServiceDisabledException;
import gridauth.fixture.AuthFixture;

@DisplayName("LegacyExchangeService")
class LegacyExchangeServiceTest {

    private static final String AUTHORIZATION = LegacyExchangeService.HEADER_PREFIX
            + Base64.getUrlEncoder().withoutPadding().encodeToString(AuthFixture.LEGACY_KEY.getBytes());

    private AuthFixture fixture;
    private LegacyExchangeService service;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = fixture.legacyExchange;
    }

    @Nested
    @DisplayName("exchange()")
    class ExchangeTests {

        @Test
        @DisplayName("should mint tokens for the registered user")
        void shouldMintTokens() {
            final var tokens = service.exchange(AUTHORIZATION, "bob", "vo:gridvo", Optional.empty())
                    .await()
                    .indefinitely();

            final var token = fixture.verifier.verify(tokens.accessToken());
            assertEquals("gridvo:bob-sub", token.subject());
            assertEquals("bob", token.preferredUsername());
            assertTrue(token.legacyExchange());
            assertTrue(tokens.hasRefreshToken());
        }

        @Test
        @DisplayName("should cap the requested lifetime")
        void shouldCapLifetime() {
            final var before = Instant.now();

            final var tokens = service.exchange(AUTHORIZATION, "bob", "vo:gridvo", Optional.of(600))
                    .await()
                    .indefinitely();

            assertTrue(tokens.accessExpiresAt().isBefore(before.plus(Duration.ofMinutes(61))));
        }

        @Test
        @DisplayName("should honor a shorter requested lifetime")
        void shouldHonorShortLifetime() {
            final var before = Instant.now();

            final var tokens = service.exchange(AUTHORIZATION, "bob", "vo:gridvo", Optional.of(5))
                    .await()
                    .indefinitely();

            assertTrue(tokens.accessExpiresAt().isBefore(before.plus(Duration.ofMinutes(6))));
        }

        @Test
        @DisplayName("should reject a wrong key")
        void shouldRejectWrongKey() {
            final var wrong = LegacyExchangeService.HEADER_PREFIX
                    + Base64.getUrlEncoder().encodeToString("wrong-key".getBytes());

            assertThrows(
                    InvalidTokenException.class,
                    () -> service.exchange(wrong, "bob", "vo:gridvo", Optional.empty()).await().indefinitely());
        }

        @Test
        @DisplayName("should reject a header without the legacy prefix")
        void shouldRejectPlainBearer() {
            assertThrows(
                    InvalidRequestException.class,
                    () -> service.exchange("Bearer abc", "bob", "vo:gridvo", Optional.empty())
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should reject unregistered users")
        void shouldRejectUnknownUser() {
            assertThrows(
                    InvalidRequestException.class,
                    () -> service.exchange(AUTHORIZATION, "mallory", "vo:gridvo", Optional.empty())
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should apply group membership checks")
        void shouldCheckMembership() {
            assertThrows(
                    PermissionDeniedException.class,
                    () -> service.exchange(AUTHORIZATION, "bob", "vo:gridvo group:gridvo_admin", Optional.empty())
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should reject a non-positive lifetime")
        void shouldRejectNonPositiveLifetime() {
            assertThrows(
                    InvalidRequestException.class,
                    () -> service.exchange(AUTHORIZATION, "bob", "vo:gridvo", Optional.of(0))
                            .await()
                            .indefinitely());
        }
    }

    @Test
    @DisplayName("should be disabled without a configured key")
    void shouldBeDisabledWithoutKey() {
        when(fixture.legacyConfig.hashedApiKey()).thenReturn(Optional.empty());

        assertFalse(service.isEnabled());
        assertThrows(
                ServiceDisabledException.class,
                () -> service.exchange(AUTHORIZATION, "bob", "vo:gridvo", Optional.empty())
                        .await()
                        .indefinitely());
    }
}
