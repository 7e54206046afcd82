package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.model.Queue;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;

import java.util.Map;

public final class QueueService extends BaseService {

    private static final Map<String, String> RENAMES = Map.of(
        "creationTime", "createdTime",
        "organizationUnitId", "folderId",
        "organizationUnitFullyQualifiedName", "folderName"
    );

    private final ListConfig<Queue> listConfig = BaseService.<Queue>odataCollection(Queue.class, RENAMES)
        .endpoints(Endpoints.QUEUES_ACROSS_FOLDERS, Endpoints.QUEUES_BY_FOLDER)
        .build();

    public QueueService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<Queue> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    public ListResponse<Queue> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(listConfig, options);
    }
}
