package cloud.meridian.sdk.pagination;

import cloud.meridian.sdk.ValidationException;

/**
 * Raised when a cursor value cannot be decoded into cursor data.
 */
public final class InvalidCursorException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidCursorException(String message) {
        super(message);
    }

    public InvalidCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
