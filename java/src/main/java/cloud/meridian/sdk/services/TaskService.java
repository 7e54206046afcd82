package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.ValidationException;
import cloud.meridian.sdk.model.Task;
import cloud.meridian.sdk.model.TaskUser;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action Center tasks.
 *
 * <p>
 * Tasks are always listed across folders. A folder id still sends the scope header and additionally narrows the
 * result with an {@code organizationUnitId} filter.
 * </p>
 */
public final class TaskService extends BaseService {

    /** Boolean option selecting the administrator listing, which includes tasks assigned to anyone. */
    public static final String AS_TASK_ADMIN = "asTaskAdmin";

    /** Relations every task listing expands; caller expansions are appended. */
    public static final String DEFAULT_EXPAND = "AssignedToUser,CreatorUser,LastModifierUser";

    private static final Map<String, String> RENAMES = Map.of(
        "completionTime", "completedTime",
        "deletionTime", "deletedTime",
        "lastModificationTime", "lastModifiedTime",
        "creationTime", "createdTime",
        "organizationUnitId", "folderId"
    );

    private final ListConfig<Task> taskConfig = taskConfig(Endpoints.TASKS_ACROSS_FOLDERS);
    private final ListConfig<Task> adminTaskConfig = taskConfig(Endpoints.TASKS_ACROSS_FOLDERS_ADMIN);

    public TaskService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<Task> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    /**
     * Lists tasks. Set {@link #AS_TASK_ADMIN} to {@code true} through {@link ListOptions.Builder#param} for the
     * administrator view; the flag itself is not sent.
     */
    public ListResponse<Task> getAll(ListOptions options) throws MeridianException {
        ListOptions resolved = options == null ? ListOptions.none() : options;
        boolean admin = isTrue(resolved.getParams().get(AS_TASK_ADMIN));
        return pagination.getAll(admin ? adminTaskConfig : taskConfig, resolved);
    }

    /**
     * Lists users that tasks of a folder can be assigned to.
     *
     * @throws ValidationException when {@code folderId} is not positive.
     */
    public ListResponse<TaskUser> getUsers(long folderId, ListOptions options) throws MeridianException {
        if (folderId <= 0) {
            throw new ValidationException("folderId is required for getUsers");
        }
        ListConfig<TaskUser> config = BaseService.<TaskUser>odataCollection(TaskUser.class, Map.of())
            .endpoint(Endpoints.taskUsers(folderId))
            .build();
        ListOptions base = options == null ? ListOptions.none() : options;
        return pagination.getAll(config, base.toBuilder().folderId(folderId).build());
    }

    private static ListConfig<Task> taskConfig(String endpoint) {
        return BaseService.<Task>odataCollection(Task.class, RENAMES)
            .endpoint(endpoint)
            .excludeFromPrefix("event")
            .processParameters(TaskService::processTaskParameters)
            .build();
    }

    static Map<String, Object> processTaskParameters(Map<String, Object> params, Long folderId) {
        Map<String, Object> processed = new LinkedHashMap<>(params);
        processed.remove(AS_TASK_ADMIN);

        Object expand = processed.get("expand");
        processed.put("expand", expand == null ? DEFAULT_EXPAND : DEFAULT_EXPAND + "," + expand);

        if (folderId != null) {
            Object filter = processed.get("filter");
            String folderFilter = "organizationUnitId eq " + folderId;
            processed.put("filter", filter == null ? folderFilter : filter + " and " + folderFilter);
        }
        return processed;
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
