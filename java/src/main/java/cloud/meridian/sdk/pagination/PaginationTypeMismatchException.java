package cloud.meridian.sdk.pagination;

import cloud.meridian.sdk.ValidationException;

/**
 * Raised when a cursor issued by a resource of one pagination type is replayed against a resource of the other.
 */
public final class PaginationTypeMismatchException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final PaginationType cursorType;
    private final PaginationType expectedType;

    public PaginationTypeMismatchException(PaginationType cursorType, PaginationType expectedType) {
        super("Pagination type mismatch: cursor is for " + cursorType.wireValue()
            + " but service uses " + expectedType.wireValue());
        this.cursorType = cursorType;
        this.expectedType = expectedType;
    }

    public PaginationType getCursorType() {
        return cursorType;
    }

    public PaginationType getExpectedType() {
        return expectedType;
    }
}
