package cloud.meridian.sdk.pagination;

import cloud.meridian.sdk.ValidationException;

/**
 * Checks caller pagination input and turns it into {@link InternalPaginationOptions}. Every check runs before a
 * request is built, so rejected input never reaches the network.
 */
public final class PaginationValidator {

    private PaginationValidator() {
    }

    /**
     * Validates {@code options} for a resource paginated with {@code expectedType} and returns the request
     * parameters.
     *
     * @param expectedType pagination type of the resource; {@code null} skips the type checks.
     * @throws ValidationException              for non-positive sizes or pages, a cursor combined with a page jump,
     *                                          or a page jump on a token-paginated resource.
     * @throws InvalidCursorException           when the cursor cannot be decoded.
     * @throws PaginationTypeMismatchException  when the cursor was issued for the other pagination type.
     */
    public static InternalPaginationOptions validate(PaginationOptions options, PaginationType expectedType)
        throws ValidationException {
        PaginationOptions resolved = options == null ? PaginationOptions.none() : options;

        if (resolved.pageSize() != null && resolved.pageSize() <= 0) {
            throw new ValidationException("pageSize must be a positive number");
        }
        if (resolved.jumpToPage() != null && resolved.jumpToPage() <= 0) {
            throw new ValidationException("jumpToPage must be a positive number");
        }
        if (resolved.cursor() != null && resolved.jumpToPage() != null) {
            throw new ValidationException("cursor and jumpToPage cannot be used together");
        }

        validateCursor(resolved.cursor(), expectedType);

        if (resolved.jumpToPage() != null && expectedType == PaginationType.TOKEN) {
            throw new ValidationException(
                "jumpToPage is not supported for token-based pagination. Use cursor-based navigation instead.");
        }

        return getRequestParameters(resolved, expectedType);
    }

    /**
     * Converts options into request parameters without the range checks of {@link #validate}.
     *
     * <ul>
     *   <li>page jump: the jump target becomes the page number;</li>
     *   <li>no cursor: first page, numbered 1 for offset pagination;</li>
     *   <li>cursor: page number, token and type come from the cursor, and its stored page size wins over the
     *       caller's.</li>
     * </ul>
     */
    public static InternalPaginationOptions getRequestParameters(PaginationOptions options, PaginationType type)
        throws InvalidCursorException {
        PaginationOptions resolved = options == null ? PaginationOptions.none() : options;

        if (resolved.jumpToPage() != null) {
            return new InternalPaginationOptions(resolved.pageSize(), resolved.jumpToPage(), null, null);
        }

        if (resolved.cursor() == null) {
            Integer firstPage = type == PaginationType.OFFSET ? 1 : null;
            return new InternalPaginationOptions(resolved.pageSize(), firstPage, null, null);
        }

        CursorData cursor = CursorCodec.decode(resolved.cursor().value());
        Integer pageSize = cursor.pageSize() != null && cursor.pageSize() > 0 ? cursor.pageSize() : resolved.pageSize();
        return new InternalPaginationOptions(pageSize, cursor.pageNumber(), cursor.continuationToken(), cursor.type());
    }

    private static void validateCursor(PaginationCursor cursor, PaginationType expectedType)
        throws InvalidCursorException, PaginationTypeMismatchException {
        if (cursor == null) {
            return;
        }
        CursorData data = CursorCodec.decode(cursor.value());
        if (expectedType != null && data.type() != expectedType) {
            throw new PaginationTypeMismatchException(data.type(), expectedType);
        }
    }
}
