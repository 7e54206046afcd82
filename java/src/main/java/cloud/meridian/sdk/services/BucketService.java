package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.ValidationException;
import cloud.meridian.sdk.model.BlobItem;
import cloud.meridian.sdk.model.Bucket;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.pagination.PaginationParamNames;
import cloud.meridian.sdk.pagination.PaginationType;

import java.util.Map;

/**
 * Storage buckets and the files they hold.
 *
 * <p>
 * Buckets are an OData collection paged by offset. File listings come from the storage provider and are paged by
 * continuation token, so they support cursors but not page jumps.
 * </p>
 */
public final class BucketService extends BaseService {

    /** Path prefix filter for {@link #getFileMetaData}; sent as is. */
    public static final String PREFIX_PARAM = "prefix";

    private static final Map<String, String> BLOB_RENAMES = Map.of("fullPath", "path");

    private final ListConfig<Bucket> bucketConfig = BaseService.<Bucket>odataCollection(Bucket.class, Map.of())
        .endpoints(Endpoints.BUCKETS_ACROSS_FOLDERS, Endpoints.BUCKETS_BY_FOLDER)
        .build();

    public BucketService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    public ListResponse<Bucket> getAll() throws MeridianException {
        return getAll(ListOptions.none());
    }

    public ListResponse<Bucket> getAll(ListOptions options) throws MeridianException {
        return pagination.getAll(bucketConfig, options);
    }

    /**
     * Lists file metadata of one bucket.
     *
     * @param bucketId bucket to read; must be positive.
     * @param folderId folder holding the bucket; must be positive and overrides any folder id in {@code options}.
     * @param options  pagination input plus optional {@link #PREFIX_PARAM}; {@code null} lists everything at once.
     * @throws ValidationException when an id is not positive, or for rejected pagination input.
     */
    public ListResponse<BlobItem> getFileMetaData(long bucketId, long folderId, ListOptions options)
        throws MeridianException {
        if (bucketId <= 0) {
            throw new ValidationException("bucketId is required for getFileMetaData");
        }
        if (folderId <= 0) {
            throw new ValidationException("folderId is required for getFileMetaData");
        }

        ListConfig<BlobItem> config = ListConfig.<BlobItem>builder()
            .endpoint(Endpoints.bucketFiles(bucketId))
            .paginationType(PaginationType.TOKEN)
            .itemsField("items")
            .continuationTokenField("continuationToken")
            .paramNames(PaginationParamNames.BUCKET_TOKEN)
            .excludeFromPrefix(PREFIX_PARAM)
            .transform(camelCaseItem(BlobItem.class, BLOB_RENAMES))
            .build();

        ListOptions base = options == null ? ListOptions.none() : options;
        return pagination.getAll(config, base.toBuilder().folderId(folderId).build());
    }
}
