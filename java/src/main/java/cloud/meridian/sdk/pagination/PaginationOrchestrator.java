package cloud.meridian.sdk.pagination;

import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.ValidationException;
import cloud.meridian.sdk.http.Headers;
import cloud.meridian.sdk.http.RequestExecutor;
import cloud.meridian.sdk.http.RequestSpec;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs list operations for every resource: decides between a single plain fetch and one page of a paginated
 * fetch, shapes the request from a {@link ListConfig} and turns the answer into a {@link ListResponse}.
 *
 * <p>
 * The decision rule: pagination is requested when any of {@code pageSize}, {@code cursor} or {@code jumpToPage} is
 * set. Either way exactly one request is sent, and only after the input has been validated.
 * </p>
 */
public final class PaginationOrchestrator {

    private static final Logger LOGGER = Logger.getLogger(PaginationOrchestrator.class.getName());

    private final RequestExecutor executor;

    public PaginationOrchestrator(RequestExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Lists items of one resource.
     *
     * @return a {@link PaginatedResponse} when pagination was requested, a {@link NonPaginatedResponse} otherwise.
     * @throws ValidationException when the pagination input is rejected; nothing is sent in that case.
     * @throws MeridianException   when the request fails or an item cannot be converted.
     */
    public <T> ListResponse<T> getAll(ListConfig<T> config, ListOptions options) throws MeridianException {
        Objects.requireNonNull(config, "config");
        ListOptions resolved = options == null ? ListOptions.none() : options;
        if (resolved.hasPaginationParameters()) {
            return fetchPage(config, resolved);
        }
        return fetchAll(config, resolved);
    }

    /**
     * Fetches one page; the options must carry pagination input.
     */
    public <T> PaginatedResponse<T> getPage(ListConfig<T> config, ListOptions options) throws MeridianException {
        Objects.requireNonNull(config, "config");
        if (options == null || !options.hasPaginationParameters()) {
            throw new ValidationException("getPage requires pageSize, cursor or jumpToPage");
        }
        return fetchPage(config, options);
    }

    /**
     * Fetches everything the endpoint returns in one response; the options must not carry pagination input.
     */
    public <T> NonPaginatedResponse<T> list(ListConfig<T> config, ListOptions options) throws MeridianException {
        Objects.requireNonNull(config, "config");
        ListOptions resolved = options == null ? ListOptions.none() : options;
        if (resolved.hasPaginationParameters()) {
            throw new ValidationException("list does not accept pageSize, cursor or jumpToPage; use getPage");
        }
        return fetchAll(config, resolved);
    }

    private <T> NonPaginatedResponse<T> fetchAll(ListConfig<T> config, ListOptions options) throws MeridianException {
        Long folderId = options.getFolderId();
        String endpoint = config.endpoint(folderId);
        RequestSpec spec = RequestSpec.of(scopeHeaders(folderId), queryParameters(config, options));

        LOGGER.fine(() -> String.format(Locale.ROOT, "[meridian-sdk] list %s (folder=%s)", endpoint, folderId));

        JsonNode body = executor.get(endpoint, spec);
        List<T> items = extractItems(config, body);
        return new NonPaginatedResponse<>(items, intField(body, config.totalCountField()));
    }

    private <T> PaginatedResponse<T> fetchPage(ListConfig<T> config, ListOptions options) throws MeridianException {
        PaginationType type = config.paginationType();
        InternalPaginationOptions params = PaginationValidator.validate(options.pagination(), type);
        Map<String, Object> wireParams = RequestParameterMapper.toWireParams(type, params, config.paramNames());

        Long folderId = options.getFolderId();
        String endpoint = config.endpoint(folderId);
        RequestSpec spec = RequestSpec.of(scopeHeaders(folderId), queryParameters(config, options));

        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[meridian-sdk] page %s (type=%s, params=%s, folder=%s)", endpoint, type.wireValue(), wireParams, folderId));

        JsonNode body = executor.requestWithPaging("GET", endpoint, wireParams, spec);
        List<T> items = extractItems(config, body);
        Integer totalCount = intField(body, config.totalCountField());
        String continuationToken = textField(body, config.continuationTokenField());

        Integer currentPage = null;
        Integer pageSize;
        if (type == PaginationType.OFFSET) {
            currentPage = params.pageNumber() == null ? 1 : params.pageNumber();
            pageSize = RequestParameterMapper.limitPageSize(params.pageSize());
        } else {
            pageSize = params.pageSize() == null ? null : RequestParameterMapper.limitPageSize(params.pageSize());
        }

        boolean hasMore = PageAssembler.hasMorePages(type, new PaginationDetectionInfo(
            totalCount, pageSize, currentPage == null ? 1 : currentPage, items.size(), continuationToken));
        PageInfo pageInfo = new PageInfo(hasMore, totalCount, currentPage, pageSize, continuationToken);
        return PageAssembler.createPaginatedResponse(pageInfo, type, items);
    }

    /**
     * Applies the resource hook, then prefixes every key outside the exclusion set. Null values are dropped.
     */
    private static Map<String, Object> queryParameters(ListConfig<?> config, ListOptions options) {
        Map<String, Object> params = new LinkedHashMap<>(options.getParams());
        if (config.processParameters() != null) {
            Map<String, Object> processed = config.processParameters().apply(params, options.getFolderId());
            params = processed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(processed);
        }

        Map<String, Object> prefixed = new LinkedHashMap<>();
        String prefix = config.keyPrefix();
        params.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (prefix.isEmpty() || key.startsWith(prefix) || config.excludeFromPrefix().contains(key)) {
                prefixed.put(key, value);
            } else {
                prefixed.put(prefix + key, value);
            }
        });
        return prefixed;
    }

    private static Map<String, String> scopeHeaders(Long folderId) {
        if (folderId == null) {
            return Map.of();
        }
        return Map.of(Headers.FOLDER_ID, Long.toString(folderId));
    }

    private static <T> List<T> extractItems(ListConfig<T> config, JsonNode body) throws MeridianException {
        JsonNode array = body == null ? null : body.get(config.itemsField());
        if ((array == null || array.isNull()) && body != null && body.isArray()) {
            array = body;
        }
        List<T> items = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return items;
        }
        for (JsonNode item : array) {
            try {
                items.add(config.transform(item));
            } catch (IllegalArgumentException ex) {
                throw new MeridianException("decode list item: " + ex.getMessage(), ex);
            }
        }
        return items;
    }

    private static Integer intField(JsonNode body, String field) {
        JsonNode node = body == null ? null : body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.textValue().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static String textField(JsonNode body, String field) {
        JsonNode node = body == null ? null : body.get(field);
        if (node == null || !node.isTextual() || node.textValue().isEmpty()) {
            return null;
        }
        return node.textValue();
    }
}
