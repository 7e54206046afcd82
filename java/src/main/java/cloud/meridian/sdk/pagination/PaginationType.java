package cloud.meridian.sdk.pagination;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Paging styles offered by Meridian backends.
 */
public enum PaginationType {

    /**
     * Pages addressed by number. The backend can report a total count and serve any page directly.
     */
    OFFSET("offset"),

    /**
     * Pages addressed by an opaque continuation token issued with the previous page. No random access.
     */
    TOKEN("token");

    private final String wireValue;

    PaginationType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves a cursor type discriminator.
     *
     * @return the matching type, or {@code null} when the value is unknown.
     */
    @JsonCreator
    public static PaginationType fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PaginationType candidate : values()) {
            if (candidate.wireValue.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
