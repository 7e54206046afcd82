package cloud.meridian.sdk.pagination;

/**
 * Normalised pagination parameters for one request.
 *
 * @param pageSize          requested page size, unclamped; {@code null} when neither caller nor cursor set one.
 * @param pageNumber        1-based page number (offset pagination).
 * @param continuationToken token to resume from (token pagination).
 * @param type              pagination type recorded in the cursor, when the parameters came from one.
 */
public record InternalPaginationOptions(
    Integer pageSize,
    Integer pageNumber,
    String continuationToken,
    PaginationType type
) {
}
