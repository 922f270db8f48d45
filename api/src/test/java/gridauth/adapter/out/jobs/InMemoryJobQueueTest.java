package gridauth.adapter.out.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.MatchedJob;

@DisplayName("InMemoryJobQueue")
class InMemoryJobQueueTest {

    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue();
    }

    private static MatchedJob job(String id, String vo, Map<String, String> details) {
        return new MatchedJob(id, vo, "bob-sub", vo + "_user", details);
    }

    @Test
    @DisplayName("should hand out jobs first in, first out and only once")
    void shouldHandOutInOrder() {
        queue.submit(job("1", "gridvo", Map.of()));
        queue.submit(job("2", "gridvo", Map.of()));
        final var request = new JobMatchRequest("LCG.CERN.ch", null, Set.of());

        assertEquals("1", queue.match("gridvo", "p", request).await().indefinitely().orElseThrow().jobId());
        assertEquals("2", queue.match("gridvo", "p", request).await().indefinitely().orElseThrow().jobId());
        assertTrue(queue.match("gridvo", "p", request).await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("should skip jobs of other VOs")
    void shouldSkipOtherVos() {
        queue.submit(job("1", "othervo", Map.of()));

        assertTrue(queue.match("gridvo", "p", new JobMatchRequest(null, null, null))
                .await()
                .indefinitely()
                .isEmpty());
        assertEquals(1, queue.size());
    }

    @Test
    @DisplayName("should honor site and tag requirements")
    void shouldHonorRequirements() {
        queue.submit(job("gpu", "gridvo", Map.of("site", "LCG.CERN.ch", "tags", "GPU, MultiProcessor")));

        assertTrue(queue.match("gridvo", "p", new JobMatchRequest("LCG.CERN.ch", null, Set.of("GPU")))
                .await()
                .indefinitely()
                .isEmpty());
        assertTrue(queue.match("gridvo", "p", new JobMatchRequest("LCG.PIC.es", null, Set.of("GPU", "MultiProcessor")))
                .await()
                .indefinitely()
                .isEmpty());
        assertEquals(
                "gpu",
                queue.match("gridvo", "p", new JobMatchRequest("LCG.CERN.ch", "ce1", Set.of("GPU", "MultiProcessor")))
                        .await()
                        .indefinitely()
                        .orElseThrow()
                        .jobId());
    }
}
