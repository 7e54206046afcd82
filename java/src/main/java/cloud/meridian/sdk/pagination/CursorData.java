package cloud.meridian.sdk.pagination;

/**
 * Decoded cursor payload.
 *
 * @param type              pagination style the cursor belongs to; never {@code null}.
 * @param pageNumber        1-based page to fetch (offset cursors only).
 * @param continuationToken backend token to resume from (token cursors only).
 * @param pageSize          page size in effect when the cursor was issued.
 */
public record CursorData(
    PaginationType type,
    Integer pageNumber,
    String continuationToken,
    Integer pageSize
) {

    public static CursorData offset(int pageNumber, Integer pageSize) {
        return new CursorData(PaginationType.OFFSET, pageNumber, null, pageSize);
    }

    public static CursorData token(String continuationToken, Integer pageSize) {
        return new CursorData(PaginationType.TOKEN, null, continuationToken, pageSize);
    }
}
