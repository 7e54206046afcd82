package cloud.meridian.sdk;

import cloud.meridian.sdk.auth.StaticTokenProvider;
import cloud.meridian.sdk.auth.TokenProvider;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link MeridianClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://cloud.meridian.dev";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String organization;
    private final String tenant;
    private final String accessToken;
    private final TokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Map<String, String> headers;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.organization = builder.organization;
        this.tenant = builder.tenant;
        this.accessToken = builder.accessToken;
        this.tokenProvider = builder.tokenProvider;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.headers = builder.headers == null ? null : new LinkedHashMap<>(builder.headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        String resolvedOrganization = requireSegment(organization, "Organization");
        String resolvedTenant = requireSegment(tenant, "Tenant");

        TokenProvider resolvedProvider = tokenProvider;
        if (resolvedProvider == null) {
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("AccessToken or TokenProvider is required");
            }
            resolvedProvider = new StaticTokenProvider(accessToken);
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Map<String, String> resolvedHeaders = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && !name.isBlank() && value != null) {
                    resolvedHeaders.put(name.trim(), value);
                }
            });
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .organization(resolvedOrganization)
            .tenant(resolvedTenant)
            .accessToken(accessToken)
            .tokenProvider(resolvedProvider)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .headers(resolvedHeaders)
            .buildInternal();
    }

    private static String requireSegment(String value, String name) {
        String trimmed = Optional.ofNullable(value).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (trimmed.contains("/")) {
            throw new IllegalArgumentException(name + " must be a single path segment");
        }
        return trimmed;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getOrganization() {
        return organization;
    }

    public String getTenant() {
        return tenant;
    }

    /**
     * @return the tenant root every endpoint path is resolved against, e.g.
     *         {@code https://cloud.meridian.dev/acme/default}.
     */
    public String getTenantUrl() {
        return baseUrl + "/" + organization + "/" + tenant;
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Map<String, String> getHeaders() {
        return headers == null ? Map.of() : Collections.unmodifiableMap(headers);
    }

    public static final class Builder {
        private String baseUrl;
        private String organization;
        private String tenant;
        private String accessToken;
        private TokenProvider tokenProvider;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Map<String, String> headers;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        /**
         * Fixed bearer token; ignored when a {@link TokenProvider} is set.
         */
        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        /**
         * Headers sent with every request, in addition to authorization and scope headers.
         */
        public Builder headers(Map<String, String> headers) {
            this.headers = headers == null ? null : new LinkedHashMap<>(headers);
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
