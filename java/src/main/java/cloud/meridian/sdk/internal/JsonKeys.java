package cloud.meridian.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Key-case helpers for the Orchestrator family of endpoints, which answer with PascalCase property names.
 */
public final class JsonKeys {

    private JsonKeys() {
    }

    /**
     * Returns a copy of {@code node} in which every object key, at any depth, starts with a lower-case letter.
     * Scalars and array elements that are not objects are returned untouched.
     */
    public static JsonNode pascalToCamel(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.set(lowerFirst(field.getKey()), pascalToCamel(field.getValue()));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                result.add(pascalToCamel(element));
            }
            return result;
        }
        return node;
    }

    /**
     * Renames top-level keys according to {@code mapping} (source name to target name). Other keys are kept.
     */
    public static JsonNode rename(JsonNode node, Map<String, String> mapping) {
        if (node == null || !node.isObject() || mapping.isEmpty()) {
            return node;
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.set(mapping.getOrDefault(field.getKey(), field.getKey()), field.getValue());
        }
        return result;
    }

    static String lowerFirst(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toLowerCase(Locale.ROOT) + value.substring(1);
    }
}
