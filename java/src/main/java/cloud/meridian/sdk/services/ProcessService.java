package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.model.ProcessRelease;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;

import java.util.Map;

/**
 * Processes (releases). The same collection serves folder-scoped and unscoped calls; the scope header narrows it.
 */
public final class ProcessService extends BaseService {

    private static final Map<String, String> RENAMES = Map.ofEntries(
        Map.entry("creationTime", "createdTime"),
        Map.entry("lastModificationTime", "lastModifiedTime"),
        Map.entry("organizationUnitId", "folderId"),
        Map.entry("organizationUnitFullyQualifiedName", "folderName"),
        Map.entry("releaseKey", "processKey"),
        Map.entry("processVersion", "packageVersion"),
        Map.entry("processKey", "packageKey"),
        Map.entry("processType", "packageType")
    );

    private final ListConfig<ProcessRelease> listConfig =
        BaseService.<ProcessRelease>odataCollection(ProcessRelease.class, RENAMES)
            .endpoint(Endpoints.PROCESSES)
            .build();

    public ProcessService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<ProcessRelease> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    public ListResponse<ProcessRelease> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(listConfig, options);
    }
}
