package cloud.meridian.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for building request URIs and issuing HTTP requests that expect JSON back.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Appends {@code params} to {@code url} as a query string. {@code null} values are skipped; keys and values are
     * form-encoded except for {@code $}, which OData keys keep literally.
     */
    public static URI buildUri(String url, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return URI.create(url);
        }
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            query.add(encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())));
        }
        if (query.length() == 0) {
            return URI.create(url);
        }
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + query);
    }

    public static HttpResponse<java.io.InputStream> send(
        HttpClient client,
        String method,
        URI uri,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .method(method, HttpRequest.BodyPublishers.noBody());

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }

        builder.header("Accept", "application/json");
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getValue() != null) {
                    builder.setHeader(header.getKey(), header.getValue());
                }
            }
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("%24", "$")
            .replace("+", "%20");
    }
}
