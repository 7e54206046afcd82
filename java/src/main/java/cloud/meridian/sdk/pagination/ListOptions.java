package cloud.meridian.sdk.pagination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call input for list operations: pagination fields, an optional folder scope and query parameters.
 *
 * <p>
 * Setting any of {@code pageSize}, {@code cursor} or {@code jumpToPage} selects the paginated flow. Query
 * parameters are sent as given, except that the resource may prefix their keys (OData resources turn
 * {@code filter} into {@code $filter}).
 * </p>
 */
public final class ListOptions {

    private static final ListOptions NONE = new Builder().build();

    private final Integer pageSize;
    private final PaginationCursor cursor;
    private final Integer jumpToPage;
    private final Long folderId;
    private final Map<String, Object> params;

    private ListOptions(Builder builder) {
        this.pageSize = builder.pageSize;
        this.cursor = builder.cursor;
        this.jumpToPage = builder.jumpToPage;
        this.folderId = builder.folderId;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ListOptions none() {
        return NONE;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .pageSize(pageSize)
            .cursor(cursor)
            .jumpToPage(jumpToPage)
            .folderId(folderId);
        builder.params.putAll(params);
        return builder;
    }

    public PaginationOptions pagination() {
        return new PaginationOptions(pageSize, cursor, jumpToPage);
    }

    public boolean hasPaginationParameters() {
        return pagination().hasPaginationParameters();
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public PaginationCursor getCursor() {
        return cursor;
    }

    public Integer getJumpToPage() {
        return jumpToPage;
    }

    public Long getFolderId() {
        return folderId;
    }

    /**
     * @return query parameters in insertion order, without pagination fields or the folder scope.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    public static final class Builder {
        private Integer pageSize;
        private PaginationCursor cursor;
        private Integer jumpToPage;
        private Long folderId;
        private final Map<String, Object> params = new LinkedHashMap<>();

        public Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder cursor(PaginationCursor cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder jumpToPage(Integer jumpToPage) {
            this.jumpToPage = jumpToPage;
            return this;
        }

        public Builder pagination(PaginationOptions options) {
            if (options != null) {
                this.pageSize = options.pageSize();
                this.cursor = options.cursor();
                this.jumpToPage = options.jumpToPage();
            }
            return this;
        }

        /**
         * Scopes the call to one folder (organization unit).
         */
        public Builder folderId(Long folderId) {
            this.folderId = folderId;
            return this;
        }

        public Builder filter(String filter) {
            return param("filter", filter);
        }

        public Builder orderby(String orderby) {
            return param("orderby", orderby);
        }

        public Builder expand(String expand) {
            return param("expand", expand);
        }

        public Builder select(String select) {
            return param("select", select);
        }

        /**
         * Adds a query parameter; a {@code null} value removes it.
         */
        public Builder param(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("parameter name must be non-empty");
            }
            if (value == null) {
                params.remove(key);
            } else {
                params.put(key, value);
            }
            return this;
        }

        public ListOptions build() {
            return new ListOptions(this);
        }
    }
}
