package cloud.meridian.sdk;

/**
 * Exception representing an error returned by Meridian services. When the backend responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect the HTTP status, the structured error code and the request id
 * to quote to support.
 */
public final class MeridianApiException extends MeridianException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final String requestId;

    public MeridianApiException(int statusCode, String code, String message) {
        this(statusCode, code, message, null);
    }

    public MeridianApiException(int statusCode, String code, String message, String requestId) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
        this.requestId = requestId;
    }

    /**
     * @return HTTP status code returned by the Meridian API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return Meridian-specific error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    /**
     * @return value of the {@code X-Request-Id} response header, if the gateway sent one.
     */
    public String getRequestId() {
        return requestId;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Meridian request failed with status " + status;
        }
        return "Meridian request failed with status " + status + " (" + code + ")";
    }
}
