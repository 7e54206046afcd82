package cloud.meridian.sdk.pagination;

/**
 * Navigation facts about one fetched page.
 *
 * @param hasMore           whether a further page exists.
 * @param totalCount        items across all pages, when the backend reported it.
 * @param currentPage       1-based number of this page (offset pagination).
 * @param pageSize          page size in effect for this page.
 * @param continuationToken token for the following page (token pagination).
 */
public record PageInfo(
    boolean hasMore,
    Integer totalCount,
    Integer currentPage,
    Integer pageSize,
    String continuationToken
) {
}
