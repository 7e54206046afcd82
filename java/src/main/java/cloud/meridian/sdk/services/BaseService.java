package cloud.meridian.sdk.services;

import cloud.meridian.sdk.internal.Json;
import cloud.meridian.sdk.internal.JsonKeys;
import cloud.meridian.sdk.pagination.ListConfig;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.pagination.PaginationParamNames;
import cloud.meridian.sdk.pagination.PaginationType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared plumbing for resource services: every list call goes through one {@link PaginationOrchestrator}.
 */
public abstract class BaseService {

    protected final PaginationOrchestrator pagination;

    protected BaseService(PaginationOrchestrator pagination) {
        this.pagination = Objects.requireNonNull(pagination, "pagination");
    }

    /**
     * List settings shared by Orchestrator OData collections: offset paging with {@code $top}/{@code $skip},
     * items under {@code value} and the total under {@code @odata.count}.
     */
    protected static <T> ListConfig.Builder<T> odataCollection(Class<T> type, Map<String, String> renames) {
        return ListConfig.<T>builder()
            .paginationType(PaginationType.OFFSET)
            .itemsField(ListConfig.DEFAULT_ITEMS_FIELD)
            .totalCountField(ListConfig.DEFAULT_TOTAL_COUNT_FIELD)
            .paramNames(PaginationParamNames.ODATA)
            .transform(pascalCaseItem(type, renames));
    }

    /**
     * Converts a PascalCase item: keys are camel-cased at every depth, then top-level keys are renamed.
     */
    protected static <T> Function<JsonNode, T> pascalCaseItem(Class<T> type, Map<String, String> renames) {
        return node -> convert(JsonKeys.rename(JsonKeys.pascalToCamel(node), renames), type);
    }

    protected static <T> Function<JsonNode, T> camelCaseItem(Class<T> type, Map<String, String> renames) {
        return node -> convert(JsonKeys.rename(node, renames), type);
    }

    /**
     * @throws IllegalArgumentException when the node does not fit {@code type}.
     */
    protected static <T> T convert(JsonNode node, Class<T> type) {
        return Json.mapper().convertValue(node, type);
    }
}
