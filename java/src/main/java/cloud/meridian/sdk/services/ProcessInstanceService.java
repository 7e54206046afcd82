package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.model.ProcessInstance;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.pagination.PaginationParamNames;
import cloud.meridian.sdk.pagination.PaginationType;

import java.util.Map;

/**
 * Instances of orchestrated processes. The backend pages by token ({@code nextPage}) and its filters
 * ({@code packageId}, {@code processKey}, {@code errorCode}, ...) are plain query parameters.
 */
public final class ProcessInstanceService extends BaseService {

    private static final Map<String, String> RENAMES = Map.of(
        "startedTimeUtc", "startedTime",
        "completedTimeUtc", "completedTime",
        "expiryTimeUtc", "expiredTime",
        "createdAt", "createdTime",
        "updatedAt", "updatedTime"
    );

    private final ListConfig<ProcessInstance> listConfig = ListConfig.<ProcessInstance>builder()
        .endpoint(Endpoints.PROCESS_INSTANCES)
        .paginationType(PaginationType.TOKEN)
        .itemsField("instances")
        .continuationTokenField("nextPage")
        .paramNames(PaginationParamNames.PROCESS_INSTANCE_TOKEN)
        .keyPrefix(null)
        .transform(camelCaseItem(ProcessInstance.class, RENAMES))
        .build();

    public ProcessInstanceService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<ProcessInstance> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    public ListResponse<ProcessInstance> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(listConfig, options);
    }
}
