package cloud.meridian.sdk.pagination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of a listing plus the cursors to move around it.
 *
 * @param items            items of this page.
 * @param totalCount       items across all pages, when known.
 * @param hasNextPage      whether a following page exists.
 * @param nextCursor       cursor for the following page; {@code null} on the last page.
 * @param previousCursor   cursor for the preceding page (offset pagination past page 1).
 * @param currentPage      1-based number of this page (offset pagination).
 * @param totalPages       number of pages, when the total and page size are known.
 * @param supportsPageJump whether the resource accepts {@code jumpToPage}.
 */
public record PaginatedResponse<T>(
    List<T> items,
    Integer totalCount,
    boolean hasNextPage,
    PaginationCursor nextCursor,
    PaginationCursor previousCursor,
    Integer currentPage,
    Integer totalPages,
    boolean supportsPageJump
) implements ListResponse<T> {

    public PaginatedResponse {
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public boolean isPaginated() {
        return true;
    }
}
