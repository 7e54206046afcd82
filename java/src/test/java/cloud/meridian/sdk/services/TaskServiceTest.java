package cloud.meridian.sdk.services;

import cloud.meridian.sdk.ValidationException;
import cloud.meridian.sdk.http.Headers;
import cloud.meridian.sdk.http.RecordingExecutor;
import cloud.meridian.sdk.model.Task;
import cloud.meridian.sdk.model.TaskStatus;
import cloud.meridian.sdk.model.TaskUser;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private RecordingExecutor executor;
    private TaskService service;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        service = new TaskService(new PaginationOrchestrator(executor));
    }

    @Test
    void listsTasksWithDefaultExpansion() throws Exception {
        executor.respondWith("{\"value\":[{\"Id\":8,\"Title\":\"Approve invoice\",\"Status\":1,"
            + "\"OrganizationUnitId\":4,\"CreationTime\":\"2024-01-10T09:00:00Z\","
            + "\"AssignedToUser\":{\"Id\":2,\"EmailAddress\":\"ops@example.test\"}}]}");

        ListResponse<Task> response = service.getAll();

        assertEquals(Endpoints.TASKS_ACROSS_FOLDERS, executor.lastCall().path());
        assertEquals(Map.of("$expand", TaskService.DEFAULT_EXPAND), executor.lastCall().spec().params());
        Task task = response.items().get(0);
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(4L, task.folderId());
        assertEquals(Instant.parse("2024-01-10T09:00:00Z"), task.createdTime());
        assertEquals("ops@example.test", task.assignedToUser().emailAddress());
    }

    @Test
    void adminFlagSelectsAdminEndpointAndIsNotSent() throws Exception {
        executor.respondWith("{\"value\":[]}");

        service.getAll(ListOptions.builder()
            .param(TaskService.AS_TASK_ADMIN, true)
            .expand("Activities")
            .param("event", "assigned")
            .build());

        RecordingExecutor.Call call = executor.lastCall();
        assertEquals(Endpoints.TASKS_ACROSS_FOLDERS_ADMIN, call.path());
        assertFalse(call.spec().params().containsKey(TaskService.AS_TASK_ADMIN));
        assertFalse(call.spec().params().containsKey("$" + TaskService.AS_TASK_ADMIN));
        assertEquals(TaskService.DEFAULT_EXPAND + ",Activities", call.spec().params().get("$expand"));
        assertEquals("assigned", call.spec().params().get("event"));
    }

    @Test
    void folderScopeAddsHeaderAndFilter() throws Exception {
        executor.respondWith("{\"value\":[]}").respondWith("{\"@odata.count\":0,\"value\":[]}");

        service.getAll(ListOptions.builder().folderId(4L).filter("Priority eq 'High'").build());
        RecordingExecutor.Call plain = executor.lastCall();
        service.getAll(ListOptions.builder().folderId(4L).pageSize(20).build());
        RecordingExecutor.Call paged = executor.lastCall();

        assertEquals(Endpoints.TASKS_ACROSS_FOLDERS, plain.path());
        assertEquals("4", plain.spec().headers().get(Headers.FOLDER_ID));
        assertEquals("Priority eq 'High' and organizationUnitId eq 4", plain.spec().params().get("$filter"));
        assertEquals("organizationUnitId eq 4", paged.spec().params().get("$filter"));
        assertEquals("4", paged.spec().headers().get(Headers.FOLDER_ID));
    }

    @Test
    void listsAssignableUsersOfAFolder() throws Exception {
        executor.respondWith("{\"value\":[{\"Id\":2,\"UserName\":\"ops\",\"DisplayName\":\"Ops Team\"}]}");

        ListResponse<TaskUser> users = service.getUsers(4, null);

        assertEquals(Endpoints.taskUsers(4), executor.lastCall().path());
        assertEquals("4", executor.lastCall().spec().headers().get(Headers.FOLDER_ID));
        assertEquals("Ops Team", users.items().get(0).displayName());
        assertThrows(ValidationException.class, () -> service.getUsers(0, null));
    }
}
