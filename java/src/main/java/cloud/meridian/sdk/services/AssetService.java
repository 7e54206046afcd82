package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.model.Asset;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;

import java.util.Map;

/**
 * Orchestrator assets. Without a folder id the listing spans every folder the caller can see.
 */
public final class AssetService extends BaseService {

    private static final Map<String, String> RENAMES = Map.of(
        "creationTime", "createdTime",
        "lastModificationTime", "lastModifiedTime"
    );

    private final ListConfig<Asset> listConfig = BaseService.<Asset>odataCollection(Asset.class, RENAMES)
        .endpoints(Endpoints.ASSETS_ACROSS_FOLDERS, Endpoints.ASSETS_BY_FOLDER)
        .build();

    public AssetService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<Asset> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    /**
     * Lists assets; any of {@code pageSize}, {@code cursor} or {@code jumpToPage} makes it a single page.
     */
    public ListResponse<Asset> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(listConfig, options);
    }
}
