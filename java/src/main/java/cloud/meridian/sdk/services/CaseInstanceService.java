package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.model.CaseInstance;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.pagination.PaginationParamNames;
import cloud.meridian.sdk.pagination.PaginationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Case management instances. They share the process instance endpoint and its {@code nextPage} token paging;
 * every call is narrowed to {@link #CASE_MANAGEMENT} processes.
 */
public final class CaseInstanceService extends BaseService {

    static final String PROCESS_TYPE = "processType";
    static final String CASE_MANAGEMENT = "CaseManagement";

    private static final Map<String, String> RENAMES = Map.of(
        "startedTimeUtc", "startedTime",
        "completedTimeUtc", "completedTime",
        "expiryTimeUtc", "expiredTime",
        "createdAt", "createdTime",
        "updatedAt", "updatedTime",
        "externalId", "caseId"
    );

    private final ListConfig<CaseInstance> listConfig = ListConfig.<CaseInstance>builder()
        .endpoint(Endpoints.PROCESS_INSTANCES)
        .paginationType(PaginationType.TOKEN)
        .itemsField("instances")
        .continuationTokenField("nextPage")
        .paramNames(PaginationParamNames.PROCESS_INSTANCE_TOKEN)
        .keyPrefix(null)
        .processParameters(CaseInstanceService::processCaseParameters)
        .transform(camelCaseItem(CaseInstance.class, RENAMES))
        .build();

    public CaseInstanceService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<CaseInstance> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    public ListResponse<CaseInstance> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(listConfig, options);
    }

    static Map<String, Object> processCaseParameters(Map<String, Object> params, Long folderId) {
        Map<String, Object> processed = new LinkedHashMap<>(params);
        processed.put(PROCESS_TYPE, CASE_MANAGEMENT);
        return processed;
    }
}
