package cloud.meridian.sdk.pagination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Items of a list call made without pagination input.
 */
public record NonPaginatedResponse<T>(List<T> items, Integer totalCount) implements ListResponse<T> {

    public NonPaginatedResponse {
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public boolean isPaginated() {
        return false;
    }
}
