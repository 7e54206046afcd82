package cloud.meridian.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * How one resource lists its items: where to call, how its pages are shaped and how items are converted.
 *
 * <table>
 *   <caption>Options and defaults</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr><td>{@code endpoint}</td><td>required</td><td>path for a folder id ({@code null} when unscoped)</td></tr>
 *   <tr><td>{@code transform}</td><td>required</td><td>converts one raw item</td></tr>
 *   <tr><td>{@code paginationType}</td><td>{@link PaginationType#OFFSET}</td><td>paging style</td></tr>
 *   <tr><td>{@code itemsField}</td><td>{@value #DEFAULT_ITEMS_FIELD}</td><td>body field holding the items</td></tr>
 *   <tr><td>{@code totalCountField}</td><td>{@value #DEFAULT_TOTAL_COUNT_FIELD}</td><td>body field holding the total</td></tr>
 *   <tr><td>{@code continuationTokenField}</td><td>{@value #DEFAULT_CONTINUATION_TOKEN_FIELD}</td>
 *       <td>body field holding the next token</td></tr>
 *   <tr><td>{@code paramNames}</td><td>by type</td><td>wire names of the pagination parameters</td></tr>
 *   <tr><td>{@code keyPrefix}</td><td>{@value #DEFAULT_KEY_PREFIX}</td><td>prefix added to query parameter keys</td></tr>
 *   <tr><td>{@code excludeFromPrefix}</td><td>none</td><td>query keys sent without the prefix</td></tr>
 *   <tr><td>{@code processParameters}</td><td>identity</td><td>rewrites query parameters before prefixing</td></tr>
 * </table>
 *
 * @param <T> converted item type.
 */
public final class ListConfig<T> {

    public static final String DEFAULT_ITEMS_FIELD = "value";
    public static final String DEFAULT_TOTAL_COUNT_FIELD = "@odata.count";
    public static final String DEFAULT_CONTINUATION_TOKEN_FIELD = "continuationToken";
    public static final String DEFAULT_KEY_PREFIX = "$";

    private final Function<Long, String> endpoint;
    private final Function<JsonNode, T> transform;
    private final PaginationType paginationType;
    private final String itemsField;
    private final String totalCountField;
    private final String continuationTokenField;
    private final PaginationParamNames paramNames;
    private final String keyPrefix;
    private final Set<String> excludeFromPrefix;
    private final BiFunction<Map<String, Object>, Long, Map<String, Object>> processParameters;

    private ListConfig(Builder<T> builder) {
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint");
        this.transform = Objects.requireNonNull(builder.transform, "transform");
        this.paginationType = builder.paginationType == null ? PaginationType.OFFSET : builder.paginationType;
        this.itemsField = orDefault(builder.itemsField, DEFAULT_ITEMS_FIELD);
        this.totalCountField = orDefault(builder.totalCountField, DEFAULT_TOTAL_COUNT_FIELD);
        this.continuationTokenField = orDefault(builder.continuationTokenField, DEFAULT_CONTINUATION_TOKEN_FIELD);
        this.paramNames = builder.paramNames == null
            ? PaginationParamNames.defaultsFor(this.paginationType)
            : builder.paramNames;
        this.keyPrefix = builder.keyPrefix == null ? "" : builder.keyPrefix;
        this.excludeFromPrefix = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludeFromPrefix));
        this.processParameters = builder.processParameters;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * @param folderId folder scope of the call, {@code null} when unscoped.
     */
    public String endpoint(Long folderId) {
        return endpoint.apply(folderId);
    }

    public T transform(JsonNode item) {
        return transform.apply(item);
    }

    public PaginationType paginationType() {
        return paginationType;
    }

    public String itemsField() {
        return itemsField;
    }

    public String totalCountField() {
        return totalCountField;
    }

    public String continuationTokenField() {
        return continuationTokenField;
    }

    public PaginationParamNames paramNames() {
        return paramNames;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public Set<String> excludeFromPrefix() {
        return excludeFromPrefix;
    }

    public BiFunction<Map<String, Object>, Long, Map<String, Object>> processParameters() {
        return processParameters;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public static final class Builder<T> {
        private Function<Long, String> endpoint;
        private Function<JsonNode, T> transform;
        private PaginationType paginationType;
        private String itemsField;
        private String totalCountField;
        private String continuationTokenField;
        private PaginationParamNames paramNames;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private final Set<String> excludeFromPrefix = new LinkedHashSet<>();
        private BiFunction<Map<String, Object>, Long, Map<String, Object>> processParameters;

        /**
         * Same path whatever the folder scope.
         */
        public Builder<T> endpoint(String path) {
            Objects.requireNonNull(path, "path");
            this.endpoint = folderId -> path;
            return this;
        }

        /**
         * Path chosen from the folder scope; the function receives {@code null} for unscoped calls.
         */
        public Builder<T> endpoint(Function<Long, String> endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Cross-folder path for unscoped calls, folder path when a folder id is given.
         */
        public Builder<T> endpoints(String acrossFolders, String byFolder) {
            Objects.requireNonNull(acrossFolders, "acrossFolders");
            Objects.requireNonNull(byFolder, "byFolder");
            this.endpoint = folderId -> folderId == null ? acrossFolders : byFolder;
            return this;
        }

        public Builder<T> transform(Function<JsonNode, T> transform) {
            this.transform = transform;
            return this;
        }

        public Builder<T> paginationType(PaginationType paginationType) {
            this.paginationType = paginationType;
            return this;
        }

        public Builder<T> itemsField(String itemsField) {
            this.itemsField = itemsField;
            return this;
        }

        public Builder<T> totalCountField(String totalCountField) {
            this.totalCountField = totalCountField;
            return this;
        }

        public Builder<T> continuationTokenField(String continuationTokenField) {
            this.continuationTokenField = continuationTokenField;
            return this;
        }

        public Builder<T> paramNames(PaginationParamNames paramNames) {
            this.paramNames = paramNames;
            return this;
        }

        /**
         * Prefix for query parameter keys; {@code null} or empty disables prefixing.
         */
        public Builder<T> keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder<T> excludeFromPrefix(String... keys) {
            for (String key : keys) {
                if (key != null) {
                    excludeFromPrefix.add(key);
                }
            }
            return this;
        }

        public Builder<T> processParameters(BiFunction<Map<String, Object>, Long, Map<String, Object>> processParameters) {
            this.processParameters = processParameters;
            return this;
        }

        public ListConfig<T> build() {
            return new ListConfig<>(this);
        }
    }
}
