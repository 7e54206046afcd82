package cloud.meridian.sdk;

import cloud.meridian.sdk.auth.StaticTokenProvider;
import cloud.meridian.sdk.auth.TokenProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() throws Exception {
        Config config = Config.builder()
            .organization("acme")
            .tenant("default")
            .accessToken("token")
            .build();

        assertEquals(Config.DEFAULT_BASE_URL, config.getBaseUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertNotNull(config.getHttpClient());
        assertInstanceOf(StaticTokenProvider.class, config.getTokenProvider());
        assertEquals("token", config.getTokenProvider().accessToken());
        assertEquals(Config.DEFAULT_BASE_URL + "/acme/default", config.getTenantUrl());
        assertTrue(config.getHeaders().isEmpty());
    }

    @Test
    void trimsTrailingSlashAndSegments() {
        Config config = Config.builder()
            .baseUrl("https://eu.meridian.dev/")
            .organization(" acme ")
            .tenant("prod")
            .accessToken("token")
            .build();

        assertEquals("https://eu.meridian.dev/acme/prod", config.getTenantUrl());
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder()
            .baseUrl("invalid").organization("acme").tenant("t").accessToken("x").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder()
            .tenant("t").accessToken("x").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder()
            .organization("a/b").tenant("t").accessToken("x").build());
        IllegalArgumentException missingAuth = assertThrows(IllegalArgumentException.class, () -> Config.builder()
            .organization("acme").tenant("t").build());
        assertEquals("AccessToken or TokenProvider is required", missingAuth.getMessage());
    }

    @Test
    void honoursCustomSettings() {
        TokenProvider provider = () -> "from-provider";
        Config config = Config.builder()
            .organization("acme")
            .tenant("default")
            .accessToken("ignored")
            .tokenProvider(provider)
            .httpTimeout(Duration.ofSeconds(5))
            .headers(Map.of("X-Trace", "on"))
            .build();

        assertSame(provider, config.getTokenProvider());
        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
        assertEquals(Map.of("X-Trace", "on"), config.getHeaders());
    }

    @Test
    void nonPositiveTimeoutFallsBackToDefault() {
        Config config = Config.builder()
            .organization("acme")
            .tenant("default")
            .accessToken("token")
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }
}
