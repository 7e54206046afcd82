package cloud.meridian.sdk.internal;

import cloud.meridian.sdk.MeridianApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads from Meridian services. The Orchestrator family answers with PascalCase
 * ({@code ErrorCode}/{@code Message}), the newer services with camelCase; both are understood.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static MeridianApiException decode(int statusCode, InputStream bodyStream, String requestId) throws IOException {
        if (bodyStream == null) {
            return new MeridianApiException(statusCode, null, null, requestId);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new MeridianApiException(statusCode, null, null, requestId);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            String code = firstText(node, "code", "errorCode", "ErrorCode");
            String message = firstText(node, "message", "Message", "title", "error");
            return new MeridianApiException(statusCode, code, message, requestId);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new MeridianApiException(statusCode, null, fallback, requestId);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }
}
