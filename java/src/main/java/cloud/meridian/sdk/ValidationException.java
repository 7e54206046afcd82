package cloud.meridian.sdk;

/**
 * Raised when caller input is rejected before any request is sent: non-positive page sizes or page numbers,
 * unsupported pagination combinations, missing resource identifiers.
 */
public class ValidationException extends MeridianException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
