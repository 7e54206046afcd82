package cloud.meridian.sdk.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a data entity. Columns differ per entity, so values are kept as a map keyed by field name.
 */
public record EntityRecord(String id, Map<String, Object> fields) {

    public EntityRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
