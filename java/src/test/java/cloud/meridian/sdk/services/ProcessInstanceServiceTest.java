package cloud.meridian.sdk.services;

import cloud.meridian.sdk.http.RecordingExecutor;
import cloud.meridian.sdk.model.ProcessInstance;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.PaginatedResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessInstanceServiceTest {

    @Test
    void pagesByNextPageTokenWithUnprefixedFilters() throws Exception {
        RecordingExecutor executor = new RecordingExecutor()
            .respondWith("{\"instances\":[{\"instanceId\":\"i-1\",\"latestRunStatus\":\"Running\","
                + "\"startedTimeUtc\":\"2024-06-01T12:00:00Z\"}],\"nextPage\":\"np-2\"}")
            .respondWith("{\"instances\":[]}");
        ProcessInstanceService service = new ProcessInstanceService(new PaginationOrchestrator(executor));

        PaginatedResponse<ProcessInstance> first = service.getAll(ListOptions.builder()
            .pageSize(1)
            .param("processKey", "invoice-flow")
            .build()).asPaginated();

        assertEquals(Endpoints.PROCESS_INSTANCES, executor.lastCall().path());
        assertEquals(Map.of("processKey", "invoice-flow"), executor.lastCall().spec().params());
        assertEquals(Map.of("pageSize", 1), executor.lastCall().wireParams());
        ProcessInstance instance = first.items().get(0);
        assertEquals("i-1", instance.instanceId());
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), instance.startedTime());
        assertTrue(first.hasNextPage());

        PaginatedResponse<ProcessInstance> second = service.getAll(ListOptions.builder()
            .cursor(first.nextCursor())
            .param("processKey", "invoice-flow")
            .build()).asPaginated();

        assertEquals(Map.of("pageSize", 1, "nextPage", "np-2"), executor.lastCall().wireParams());
        assertTrue(second.items().isEmpty());
        assertFalse(second.hasNextPage());
    }
}
