package cloud.meridian.sdk.services;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.ValidationException;
import cloud.meridian.sdk.internal.Json;
import cloud.meridian.sdk.model.EntityRecord;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.pagination.PaginationParamNames;
import cloud.meridian.sdk.pagination.PaginationType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Data Fabric entities. Record reads page by {@code limit}/{@code start} and always report
 * {@code totalRecordCount}.
 */
public final class EntityService extends BaseService {

    /** Depth of related records to inline; sent without a prefix. */
    public static final String EXPANSION_LEVEL_PARAM = "expansionLevel";

    public EntityService(PaginationOrchestrator pagination) {
        super(pagination);
    }

    /**
     * @throws ValidationException when {@code entityId} is blank, or for rejected pagination input.
     */
    public ListResponse<EntityRecord> getRecordsById(String entityId, ListOptions options) throws MeridianException {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("entityId is required for getRecordsById");
        }
        ListConfig<EntityRecord> config = ListConfig.<EntityRecord>builder()
            .endpoint(Endpoints.entityRecords(entityId.trim()))
            .paginationType(PaginationType.OFFSET)
            .itemsField("value")
            .totalCountField("totalRecordCount")
            .paramNames(PaginationParamNames.ENTITY)
            .excludeFromPrefix(EXPANSION_LEVEL_PARAM)
            .transform(EntityService::toRecord)
            .build();
        return pagination.getAll(config, options);
    }

    private static EntityRecord toRecord(JsonNode node) {
        JsonNode id = node.has("Id") ? node.get("Id") : node.get("id");
        String recordId = id == null || id.isNull() ? null : id.asText();
        return new EntityRecord(recordId, Json.toMap(node));
    }
}
