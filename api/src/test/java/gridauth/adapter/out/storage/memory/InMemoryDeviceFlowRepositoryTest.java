package gridauth.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gridauth.core.model.flow.DeviceFlowRecord;
import gridauth.core.model.flow.FlowStatus;

@DisplayName("InMemoryDeviceFlowRepository")
class InMemoryDeviceFlowRepositoryTest {

    private InMemoryDeviceFlowRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDeviceFlowRepository();
    }

    private static DeviceFlowRecord flow(String id, String userCode, Instant expiresAt) {
        return DeviceFlowRecord.pending(
                id, userCode, "test-client", "vo:gridvo", "challenge", Duration.ofSeconds(5), Instant.now(), expiresAt);
    }

    @Test
    @DisplayName("insert() should refuse a user code already in use")
    void insertShouldRefuseDuplicateUserCode() {
        final var expires = Instant.now().plusSeconds(600);

        assertTrue(repository.insert(flow("a", "BCDFGHJK", expires)).await().indefinitely());
        assertFalse(repository.insert(flow("b", "BCDFGHJK", expires)).await().indefinitely());
        assertTrue(repository.findById("b").await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("should find a flow by its user code")
    void shouldFindByUserCode() {
        repository.insert(flow("a", "BCDFGHJK", Instant.now().plusSeconds(600))).await().indefinitely();

        assertEquals("a", repository.findByUserCode("BCDFGHJK").await().indefinitely().orElseThrow().id());
        assertTrue(repository.findByUserCode("ZZZZZZZZ").await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("replace() should let only one of two racing completions win")
    void replaceShouldBeCompareAndSwap() {
        final var pending = flow("a", "BCDFGHJK", Instant.now().plusSeconds(600));
        repository.insert(pending).await().indefinitely();

        final var first = repository.replace(pending, pending.withStatus(FlowStatus.COMPLETED)).await().indefinitely();
        final var second = repository.replace(pending, pending.withStatus(FlowStatus.DENIED)).await().indefinitely();

        assertTrue(first);
        assertFalse(second);
        assertEquals(FlowStatus.COMPLETED, repository.findById("a").await().indefinitely().orElseThrow().status());
    }

    @Test
    @DisplayName("purgeExpired() should free the user code of expired flows")
    void purgeShouldFreeUserCode() {
        repository.insert(flow("a", "BCDFGHJK", Instant.now().minusSeconds(1))).await().indefinitely();

        assertEquals(1, repository.purgeExpired(Instant.now()).await().indefinitely());
        assertTrue(repository.insert(flow("b", "BCDFGHJK", Instant.now().plusSeconds(600)))
                .await()
                .indefinitely());
    }
}
