package cloud.meridian.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonKeysTest {

    @Test
    void camelCasesKeysAtEveryDepth() throws Exception {
        JsonNode source = Json.mapper().readTree(
            "{\"Id\":1,\"AssignedToUser\":{\"EmailAddress\":\"a@b.c\"},\"Tags\":[{\"DisplayName\":\"x\"},\"Raw\"]}");

        JsonNode converted = JsonKeys.pascalToCamel(source);

        assertEquals(1, converted.path("id").asInt());
        assertEquals("a@b.c", converted.path("assignedToUser").path("emailAddress").asText());
        assertEquals("x", converted.path("tags").get(0).path("displayName").asText());
        assertEquals("Raw", converted.path("tags").get(1).asText());
        assertTrue(source.has("Id"), "source must stay untouched");
    }

    @Test
    void renamesTopLevelKeysOnly() throws Exception {
        JsonNode source = Json.mapper().readTree(
            "{\"creationTime\":\"t\",\"nested\":{\"creationTime\":\"n\"},\"name\":\"keep\"}");

        JsonNode renamed = JsonKeys.rename(source, Map.of("creationTime", "createdTime"));

        assertEquals("t", renamed.path("createdTime").asText());
        assertFalse(renamed.has("creationTime"));
        assertEquals("n", renamed.path("nested").path("creationTime").asText());
        assertEquals("keep", renamed.path("name").asText());
    }

    @Test
    void swapsKeysWithoutLosingValues() throws Exception {
        JsonNode source = Json.mapper().readTree("{\"releaseKey\":\"r\",\"processKey\":\"p\"}");

        JsonNode renamed = JsonKeys.rename(source, Map.of("releaseKey", "processKey", "processKey", "packageKey"));

        assertEquals("r", renamed.path("processKey").asText());
        assertEquals("p", renamed.path("packageKey").asText());
    }

    @Test
    void lowerFirstLeavesEmptyValuesAlone() {
        assertEquals("", JsonKeys.lowerFirst(""));
        assertNull(JsonKeys.lowerFirst(null));
        assertEquals("oData", JsonKeys.lowerFirst("OData"));
    }
}
