package cloud.meridian.sdk.internal;

import cloud.meridian.sdk.MeridianApiException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void readsCamelCasePayload() throws Exception {
        MeridianApiException ex = ApiErrorDecoder.decode(400, body("{\"code\":\"BAD_FILTER\",\"message\":\"bad $filter\"}"), null);

        assertEquals(400, ex.getStatusCode());
        assertEquals("BAD_FILTER", ex.getCode());
        assertEquals("bad $filter", ex.getMessage());
        assertNull(ex.getRequestId());
    }

    @Test
    void readsPascalCasePayload() throws Exception {
        MeridianApiException ex = ApiErrorDecoder.decode(404, body("{\"ErrorCode\":1002,\"Message\":\"gone\"}"), "r-1");

        assertEquals("1002", ex.getCode());
        assertEquals("gone", ex.getMessage());
        assertEquals("r-1", ex.getRequestId());
    }

    @Test
    void fallsBackToRawTextAndDefaultMessage() throws Exception {
        MeridianApiException text = ApiErrorDecoder.decode(502, body("<html>Bad Gateway</html>"), null);
        assertEquals("<html>Bad Gateway</html>", text.getMessage());
        assertNull(text.getCode());

        MeridianApiException empty = ApiErrorDecoder.decode(500, body(""), null);
        assertTrue(empty.getMessage().contains("500"));
    }

    private static InputStream body(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
