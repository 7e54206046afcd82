package cloud.meridian.sdk.pagination;

/**
 * Query-parameter spellings a backend uses for the pagination concepts. A {@code null} name falls back to the
 * default for the resource's pagination type.
 *
 * @param pageSizeParam name of the page size (or size hint) parameter.
 * @param offsetParam   name of the skip/offset parameter (offset pagination).
 * @param tokenParam    name of the continuation token parameter (token pagination).
 * @param countParam    name of the "include total count" flag (offset pagination).
 */
public record PaginationParamNames(
    String pageSizeParam,
    String offsetParam,
    String tokenParam,
    String countParam
) {

    /** OData collections: {@code $top}, {@code $skip}, {@code $count=true}. */
    public static final PaginationParamNames ODATA = new PaginationParamNames("$top", "$skip", null, "$count");

    /** Entity record reads: {@code limit}/{@code start}, with the default count flag. */
    public static final PaginationParamNames ENTITY = new PaginationParamNames("limit", "start", null, null);

    /** Bucket file listings: {@code takeHint}/{@code continuationToken}. */
    public static final PaginationParamNames BUCKET_TOKEN =
        new PaginationParamNames("takeHint", null, "continuationToken", null);

    /** Process instance listings: {@code pageSize}/{@code nextPage}. */
    public static final PaginationParamNames PROCESS_INSTANCE_TOKEN =
        new PaginationParamNames("pageSize", null, "nextPage", null);

    /**
     * @return the default names for {@code type}: {@link #ODATA} for offset, {@link #BUCKET_TOKEN} for token.
     */
    public static PaginationParamNames defaultsFor(PaginationType type) {
        return type == PaginationType.TOKEN ? BUCKET_TOKEN : ODATA;
    }
}
