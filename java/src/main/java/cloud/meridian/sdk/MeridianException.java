package cloud.meridian.sdk;

/**
 * Base exception thrown by the Meridian Java SDK.
 */
public class MeridianException extends Exception {

    private static final long serialVersionUID = 1L;

    public MeridianException(String message) {
        super(message);
    }

    public MeridianException(String message, Throwable cause) {
        super(message, cause);
    }
}
