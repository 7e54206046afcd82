package cloud.meridian.sdk.pagination;

import java.util.Objects;

/**
 * Opaque position in a listing. Obtain instances from {@link PaginatedResponse#nextCursor()} or
 * {@link PaginatedResponse#previousCursor()} and hand them back unchanged to fetch that page.
 */
public record PaginationCursor(String value) {

    public PaginationCursor {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
