package cloud.meridian.sdk.pagination;

import java.util.List;

/**
 * Result of a list call. The concrete type depends only on whether pagination input was supplied:
 * {@link PaginatedResponse} when it was, {@link NonPaginatedResponse} otherwise.
 *
 * @param <T> item type.
 */
public interface ListResponse<T> {

    List<T> items();

    /**
     * @return total number of items across all pages, or {@code null} when the backend did not report one.
     */
    Integer totalCount();

    boolean isPaginated();

    /**
     * @throws IllegalStateException when the call was made without pagination input.
     */
    default PaginatedResponse<T> asPaginated() {
        if (this instanceof PaginatedResponse) {
            return (PaginatedResponse<T>) this;
        }
        throw new IllegalStateException("response is not paginated; pass pageSize, cursor or jumpToPage");
    }
}
