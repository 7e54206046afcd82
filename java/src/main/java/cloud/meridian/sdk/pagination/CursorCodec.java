package cloud.meridian.sdk.pagination;

import cloud.meridian.sdk.internal.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Converts {@link CursorData} to and from the opaque string handed to callers.
 *
 * <p>
 * The wire form is URL-safe Base64 (without padding) of a compact JSON object:
 * {@code {"v":1,"type":"offset","pageNumber":2,"pageSize":10}}. Absent fields are omitted. The {@code v} field
 * versions the payload layout; cursors issued before it existed carry no {@code v} and are read as version 1.
 * </p>
 */
public final class CursorCodec {

    static final int CURRENT_VERSION = 1;

    private CursorCodec() {
    }

    public static String encode(CursorData data) {
        Objects.requireNonNull(data, "data");
        if (data.type() == null) {
            throw new IllegalArgumentException("cursor type is required");
        }
        CursorPayload payload = new CursorPayload(
            CURRENT_VERSION,
            data.type().wireValue(),
            data.pageNumber(),
            data.continuationToken(),
            data.pageSize()
        );
        byte[] json;
        try {
            json = Json.mapper().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("encode cursor: " + ex.getMessage(), ex);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    }

    public static PaginationCursor encodeCursor(CursorData data) {
        return new PaginationCursor(encode(data));
    }

    public static CursorData decode(String value) throws InvalidCursorException {
        if (value == null || value.isBlank()) {
            throw new InvalidCursorException("cursor must contain a valid cursor string");
        }

        byte[] json;
        try {
            json = Base64.getUrlDecoder().decode(toUrlAlphabet(value.trim()));
        } catch (IllegalArgumentException ex) {
            throw new InvalidCursorException("Invalid pagination cursor", ex);
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(new String(json, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new InvalidCursorException("Invalid pagination cursor", ex);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidCursorException("Invalid pagination cursor");
        }

        JsonNode version = node.get("v");
        if (version != null && !(version.isInt() && version.asInt() == CURRENT_VERSION)) {
            throw new InvalidCursorException("Invalid cursor: unsupported cursor version " + version);
        }

        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new InvalidCursorException("Invalid cursor: missing pagination type");
        }
        PaginationType type = PaginationType.fromWireValue(typeNode.asText());
        if (type == null) {
            throw new InvalidCursorException("Invalid cursor: unknown pagination type " + typeNode.asText());
        }

        Integer pageNumber = optionalInt(node, "pageNumber");
        Integer pageSize = optionalInt(node, "pageSize");
        String continuationToken = optionalText(node, "continuationToken");

        if (type == PaginationType.OFFSET && continuationToken != null) {
            throw new InvalidCursorException("Invalid cursor: offset cursor carries a continuation token");
        }
        if (type == PaginationType.TOKEN && pageNumber != null) {
            throw new InvalidCursorException("Invalid cursor: token cursor carries a page number");
        }
        if (pageNumber != null && pageNumber < 1) {
            throw new InvalidCursorException("Invalid cursor: pageNumber must be positive");
        }
        if (pageSize != null && pageSize < 1) {
            throw new InvalidCursorException("Invalid cursor: pageSize must be positive");
        }
        if (type == PaginationType.TOKEN && (continuationToken == null || continuationToken.isEmpty())) {
            throw new InvalidCursorException("Invalid cursor: token cursor carries no continuation token");
        }
        return new CursorData(type, pageNumber, continuationToken, pageSize);
    }

    private static Integer optionalInt(JsonNode node, String field) throws InvalidCursorException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isInt()) {
            throw new InvalidCursorException("Invalid cursor: " + field + " must be an integer");
        }
        return value.asInt();
    }

    private static String optionalText(JsonNode node, String field) throws InvalidCursorException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidCursorException("Invalid cursor: " + field + " must be a string");
        }
        return value.asText();
    }

    // accepts cursors produced with the standard alphabet and/or padding
    private static String toUrlAlphabet(String value) {
        String converted = value.replace('+', '-').replace('/', '_');
        int end = converted.length();
        while (end > 0 && converted.charAt(end - 1) == '=') {
            end--;
        }
        return converted.substring(0, end);
    }

    private record CursorPayload(
        int v,
        String type,
        Integer pageNumber,
        String continuationToken,
        Integer pageSize
    ) {
    }
}
