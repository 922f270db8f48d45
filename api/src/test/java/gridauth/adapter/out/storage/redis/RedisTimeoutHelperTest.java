package gridauth.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gridauth.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import gridauth.spi.StorageProviderException;

@DisplayName("RedisTimeoutHelper")
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, "TestRepository");
    }

    @Test
    @DisplayName("should return the result when the operation completes in time")
    void shouldReturnResult() {
        final var result = helper.withTimeout(Uni.createFrom().item("ok"), "get").await().indefinitely();

        assertEquals("ok", result);
    }

    @Test
    @DisplayName("should fail with RedisTimeoutException when the operation hangs")
    void shouldFailOnTimeout() {
        final var operation = Uni.createFrom().<String>nothing();

        final var e = assertThrows(
                RedisTimeoutException.class,
                () -> helper.withTimeout(operation, "replace").await().atMost(Duration.ofSeconds(5)));

        assertEquals("replace", e.getOperation());
        assertEquals("TestRepository", e.getRepository());
    }

    @Test
    @DisplayName("timeouts should surface as storage failures")
    void timeoutShouldBeStorageFailure() {
        final var operation = Uni.createFrom().<String>nothing();

        assertThrows(
                StorageProviderException.class,
                () -> helper.withTimeout(operation, "insert").await().atMost(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("should propagate other failures unchanged")
    void shouldPropagateOtherFailures() {
        final var operation = Uni.createFrom().<String>failure(new IllegalStateException("boom"));

        final var e = assertThrows(
                IllegalStateException.class, () -> helper.withTimeout(operation, "get").await().indefinitely());

        assertEquals("boom", e.getMessage());
    }
}
