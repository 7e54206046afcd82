package cloud.meridian.sdk.model;

import cloud.meridian.sdk.internal.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void resolvesNumericAndNamedValues() {
        assertEquals(TaskStatus.UNASSIGNED, TaskStatus.fromValue(0));
        assertEquals(TaskStatus.PENDING, TaskStatus.fromValue("Pending"));
        assertEquals(TaskStatus.COMPLETED, TaskStatus.fromValue("2"));
        assertNull(TaskStatus.fromValue(9));
        assertNull(TaskStatus.fromValue(null));
    }

    @Test
    void deserializesFromTaskPayload() throws Exception {
        Task task = Json.mapper().readValue("{\"id\":5,\"status\":1,\"title\":\"Review\"}", Task.class);

        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals("\"Pending\"", Json.mapper().writeValueAsString(TaskStatus.PENDING));
    }
}
