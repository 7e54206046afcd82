package cloud.meridian.sdk.http;

import cloud.meridian.sdk.MeridianException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Performs the network calls behind list operations. Implementations own transport, authentication and header
 * injection; they do not interpret pagination fields in the body.
 *
 * <p>
 * Failures surface as {@link MeridianException} (typically {@link cloud.meridian.sdk.MeridianApiException} for
 * non-2xx answers) and are passed through unchanged by the pagination layer.
 * </p>
 */
public interface RequestExecutor {

    /**
     * Issues a single GET.
     *
     * @param path endpoint path relative to the tenant root.
     * @return the decoded JSON body; an empty object node for empty bodies.
     */
    JsonNode get(String path, RequestSpec spec) throws MeridianException;

    /**
     * Issues a single page request. {@code wireParams} are merged over the query parameters of {@code spec}.
     */
    JsonNode requestWithPaging(String method, String path, Map<String, Object> wireParams, RequestSpec spec)
        throws MeridianException;
}
