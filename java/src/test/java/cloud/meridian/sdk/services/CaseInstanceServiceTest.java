package cloud.meridian.sdk.services;

import cloud.meridian.sdk.http.RecordingExecutor;
import cloud.meridian.sdk.model.CaseInstance;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginatedResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CaseInstanceServiceTest {

    private RecordingExecutor executor;
    private CaseInstanceService service;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        service = new CaseInstanceService(new PaginationOrchestrator(executor));
    }

    @Test
    void listsOnlyCaseManagementInstances() throws Exception {
        executor.respondWith("{\"instances\":[{\"instanceId\":\"c-1\",\"externalId\":\"CASE-42\","
            + "\"completedTimeUtc\":\"2024-07-01T08:30:00Z\"}]}");

        ListResponse<CaseInstance> response = service.getAll();

        assertFalse(executor.lastCall().paged());
        assertEquals(Endpoints.PROCESS_INSTANCES, executor.lastCall().path());
        assertEquals(Map.of("processType", "CaseManagement"), executor.lastCall().spec().params());
        CaseInstance instance = response.items().get(0);
        assertEquals("c-1", instance.instanceId());
        assertEquals("CASE-42", instance.caseId());
        assertEquals(Instant.parse("2024-07-01T08:30:00Z"), instance.completedTime());
    }

    @Test
    void pagesByNextPageTokenKeepingFiltersUnprefixed() throws Exception {
        executor.respondWith("{\"instances\":[{\"instanceId\":\"c-1\"}],\"nextPage\":\"np-2\"}")
            .respondWith("{\"instances\":[{\"instanceId\":\"c-2\"}]}");

        PaginatedResponse<CaseInstance> first = service.getAll(ListOptions.builder()
            .pageSize(1)
            .param("processKey", "claims")
            .param("processType", "ProcessOrchestration")
            .build()).asPaginated();

        assertEquals(Map.of("processKey", "claims", "processType", "CaseManagement"),
            executor.lastCall().spec().params());
        assertEquals(Map.of("pageSize", 1), executor.lastCall().wireParams());
        assertTrue(first.hasNextPage());
        assertFalse(first.supportsPageJump());

        PaginatedResponse<CaseInstance> second = service.getAll(ListOptions.builder()
            .cursor(first.nextCursor())
            .build()).asPaginated();

        assertEquals(Map.of("pageSize", 1, "nextPage", "np-2"), executor.lastCall().wireParams());
        assertEquals("c-2", second.items().get(0).instanceId());
        assertFalse(second.hasNextPage());
        assertNull(second.nextCursor());
    }
}
