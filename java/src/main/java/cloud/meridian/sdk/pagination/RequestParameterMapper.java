package cloud.meridian.sdk.pagination;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates {@link InternalPaginationOptions} into the query parameters a backend understands.
 */
public final class RequestParameterMapper {

    /** Page size used when the caller asked for a page without naming a size. */
    public static final int DEFAULT_PAGE_SIZE = 50;

    /** Upper bound for any single fetch, whatever the caller requests. */
    public static final int MAX_PAGE_SIZE = 1000;

    private RequestParameterMapper() {
    }

    /**
     * @return the page size clamped into {@code [1, MAX_PAGE_SIZE]}, or {@link #DEFAULT_PAGE_SIZE} when unset.
     */
    public static int limitPageSize(Integer pageSize) {
        if (pageSize == null) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
    }

    /**
     * Builds the wire parameters for one page request.
     *
     * <p>
     * Offset resources always receive a page size, the count flag and, past the first page, an offset computed from
     * the clamped size. Token resources receive a size hint only when a size was requested, and the continuation
     * token verbatim.
     * </p>
     *
     * @param paramNames per-resource parameter names; {@code null} uses {@link PaginationParamNames#defaultsFor}.
     * @return an insertion-ordered, mutable map.
     */
    public static Map<String, Object> toWireParams(
        PaginationType type,
        InternalPaginationOptions params,
        PaginationParamNames paramNames
    ) {
        PaginationParamNames defaults = PaginationParamNames.defaultsFor(type);
        PaginationParamNames names = paramNames == null ? defaults : paramNames;
        Map<String, Object> wire = new LinkedHashMap<>();

        if (type == PaginationType.OFFSET) {
            int pageSize = limitPageSize(params.pageSize());
            wire.put(orDefault(names.pageSizeParam(), defaults.pageSizeParam()), pageSize);
            if (params.pageNumber() != null && params.pageNumber() > 1) {
                long offset = (long) (params.pageNumber() - 1) * pageSize;
                wire.put(orDefault(names.offsetParam(), defaults.offsetParam()), offset);
            }
            wire.put(orDefault(names.countParam(), defaults.countParam()), true);
            return wire;
        }

        if (params.pageSize() != null) {
            wire.put(orDefault(names.pageSizeParam(), defaults.pageSizeParam()), limitPageSize(params.pageSize()));
        }
        if (params.continuationToken() != null && !params.continuationToken().isEmpty()) {
            wire.put(orDefault(names.tokenParam(), defaults.tokenParam()), params.continuationToken());
        }
        return wire;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
