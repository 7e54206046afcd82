package cloud.meridian.sdk.pagination;

import java.util.List;

/**
 * Builds {@link PaginatedResponse} instances from a fetched page. Pure functions: equal inputs give equal outputs.
 */
public final class PageAssembler {

    private PageAssembler() {
    }

    /**
     * Decides whether a page has a successor.
     *
     * <p>
     * Offset pagination with a reported total is exact. Without a total the check falls back to "the page came back
     * full", which wrongly reports a successor when the last page is exactly full. Callers relying on the offset
     * fallback should expect one trailing empty page in that case.
     * </p>
     */
    public static boolean hasMorePages(PaginationType type, PaginationDetectionInfo info) {
        if (type == PaginationType.TOKEN) {
            return info.continuationToken() != null && !info.continuationToken().isEmpty();
        }
        int effectivePageSize = info.pageSize() == null ? RequestParameterMapper.DEFAULT_PAGE_SIZE : info.pageSize();
        if (info.totalCount() != null) {
            return (long) info.currentPage() * effectivePageSize < info.totalCount();
        }
        return info.itemsCount() == effectivePageSize;
    }

    /**
     * Creates the cursor for the page after the one described by {@code pageInfo}.
     *
     * @return {@code null} when there is no next page, when a token-paginated page claims more results but
     *         carries no token to reach them, or when the current page is the last addressable page number.
     */
    public static PaginationCursor createCursor(PageInfo pageInfo, PaginationType type) {
        if (!pageInfo.hasMore()) {
            return null;
        }
        if (type == PaginationType.TOKEN) {
            String token = pageInfo.continuationToken();
            if (token == null || token.isEmpty()) {
                return null;
            }
            return CursorCodec.encodeCursor(CursorData.token(token, pageInfo.pageSize()));
        }
        int currentPage = pageInfo.currentPage() == null ? 1 : pageInfo.currentPage();
        if (currentPage == Integer.MAX_VALUE) {
            return null;
        }
        return CursorCodec.encodeCursor(CursorData.offset(currentPage + 1, pageInfo.pageSize()));
    }

    public static <T> PaginatedResponse<T> createPaginatedResponse(PageInfo pageInfo, PaginationType type, List<T> items) {
        PaginationCursor nextCursor = createCursor(pageInfo, type);

        PaginationCursor previousCursor = null;
        if (type == PaginationType.OFFSET && pageInfo.currentPage() != null && pageInfo.currentPage() > 1) {
            previousCursor = CursorCodec.encodeCursor(CursorData.offset(pageInfo.currentPage() - 1, pageInfo.pageSize()));
        }

        Integer totalPages = null;
        if (pageInfo.totalCount() != null && pageInfo.pageSize() != null && pageInfo.pageSize() > 0) {
            totalPages = (int) Math.ceil((double) pageInfo.totalCount() / pageInfo.pageSize());
        }

        return new PaginatedResponse<>(
            items,
            pageInfo.totalCount(),
            pageInfo.hasMore(),
            nextCursor,
            previousCursor,
            pageInfo.currentPage(),
            totalPages,
            type == PaginationType.OFFSET
        );
    }
}
