package cloud.meridian.sdk.http;

/**
 * Header names understood by Meridian gateways.
 */
public final class Headers {

    public static final String FOLDER_ID = "X-MERIDIAN-OrganizationUnitId";
    public static final String REQUEST_ID = "X-Request-Id";

    private Headers() {
    }
}
