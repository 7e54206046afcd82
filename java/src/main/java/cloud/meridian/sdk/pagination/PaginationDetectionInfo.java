package cloud.meridian.sdk.pagination;

/**
 * Inputs for deciding whether a page has a successor.
 *
 * @param totalCount        reported total, if any.
 * @param pageSize          page size requested; {@code null} means the default page size.
 * @param currentPage       1-based page number.
 * @param itemsCount        number of items actually returned.
 * @param continuationToken token returned with the page, if any.
 */
public record PaginationDetectionInfo(
    Integer totalCount,
    Integer pageSize,
    int currentPage,
    int itemsCount,
    String continuationToken
) {
}
