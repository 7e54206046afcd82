package cloud.meridian.sdk.http;

import cloud.meridian.sdk.Config;
import cloud.meridian.sdk.MeridianApiException;
import cloud.meridian.sdk.MeridianException;
import cloud.meridian.sdk.auth.TokenProvider;
import cloud.meridian.sdk.internal.ApiErrorDecoder;
import cloud.meridian.sdk.internal.HttpUtil;
import cloud.meridian.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link RequestExecutor} backed by {@link HttpClient}. Resolves paths against the tenant root, attaches the bearer
 * token and configured default headers, and maps non-2xx answers to {@link MeridianApiException}.
 *
 * <p>
 * Each call is a single blocking exchange on the caller's thread; nothing is retried.
 * </p>
 */
public final class HttpRequestExecutor implements RequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(HttpRequestExecutor.class.getName());

    private final HttpClient httpClient;
    private final String tenantUrl;
    private final TokenProvider tokenProvider;
    private final Duration timeout;
    private final Map<String, String> defaultHeaders;

    public HttpRequestExecutor(Config config) {
        Objects.requireNonNull(config, "config");
        this.httpClient = config.getHttpClient();
        this.tenantUrl = config.getTenantUrl();
        this.tokenProvider = config.getTokenProvider();
        this.timeout = config.getHttpTimeout();
        this.defaultHeaders = Map.copyOf(config.getHeaders());
    }

    @Override
    public JsonNode get(String path, RequestSpec spec) throws MeridianException {
        RequestSpec resolved = spec == null ? RequestSpec.empty() : spec;
        return execute("GET", path, resolved.params(), resolved.headers());
    }

    @Override
    public JsonNode requestWithPaging(String method, String path, Map<String, Object> wireParams, RequestSpec spec)
        throws MeridianException {
        RequestSpec resolved = spec == null ? RequestSpec.empty() : spec;
        return execute(method, path, resolved.withParams(wireParams).params(), resolved.headers());
    }

    private JsonNode execute(String method, String path, Map<String, Object> params, Map<String, String> headers)
        throws MeridianException {
        Objects.requireNonNull(path, "path");
        String verb = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        URI uri = HttpUtil.buildUri(resolveUrl(path), params);

        Map<String, String> merged = new LinkedHashMap<>(defaultHeaders);
        merged.put("Authorization", "Bearer " + tokenProvider.accessToken());
        if (headers != null) {
            merged.putAll(headers);
        }

        LOGGER.fine(() -> String.format(Locale.ROOT, "[meridian-sdk] %s %s", verb, uri));

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.send(httpClient, verb, uri, merged, timeout);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new MeridianException(verb + " " + path + " interrupted", ex);
            }
            throw new MeridianException(verb + " " + path + " request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            int status = response.statusCode();
            if (status >= 400) {
                String requestId = response.headers().firstValue(Headers.REQUEST_ID).orElse(null);
                if (status == 401) {
                    tokenProvider.invalidate();
                }
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[meridian-sdk] %s %s failed with status %d", verb, path, status));
                throw ApiErrorDecoder.decode(status, bodyStream, requestId);
            }
            byte[] body = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
            if (body.length == 0) {
                return JsonNodeFactory.instance.objectNode();
            }
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new MeridianException("decode " + path + " response: " + ex.getMessage(), ex);
        }
    }

    private String resolveUrl(String path) {
        String normalized = path.startsWith("/") ? path.substring(1) : path;
        return tenantUrl + "/" + normalized;
    }
}
