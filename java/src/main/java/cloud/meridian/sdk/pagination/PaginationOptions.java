package cloud.meridian.sdk.pagination;

/**
 * Caller-facing pagination input. Use the static factories: they only build the legal shapes, so a cursor and a
 * page jump can never be requested together through them.
 *
 * @param pageSize   items per page; {@code null} lets the backend default apply.
 * @param cursor     position returned by a previous page.
 * @param jumpToPage 1-based page to fetch directly (offset-paginated resources only).
 */
public record PaginationOptions(Integer pageSize, PaginationCursor cursor, Integer jumpToPage) {

    private static final PaginationOptions NONE = new PaginationOptions(null, null, null);

    public static PaginationOptions none() {
        return NONE;
    }

    public static PaginationOptions firstPage(int pageSize) {
        return new PaginationOptions(pageSize, null, null);
    }

    public static PaginationOptions next(PaginationCursor cursor) {
        return new PaginationOptions(null, cursor, null);
    }

    public static PaginationOptions next(PaginationCursor cursor, Integer pageSize) {
        return new PaginationOptions(pageSize, cursor, null);
    }

    public static PaginationOptions jumpTo(int page, Integer pageSize) {
        return new PaginationOptions(pageSize, null, page);
    }

    /**
     * @return {@code true} when any of page size, cursor or page jump is set, which selects the paginated flow.
     */
    public boolean hasPaginationParameters() {
        return pageSize != null || cursor != null || jumpToPage != null;
    }
}
