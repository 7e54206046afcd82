package cloud.meridian.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of an Action Center task. The API reports it as a number or as a name.
 */
public enum TaskStatus {
    UNASSIGNED(0, "Unassigned"),
    PENDING(1, "Pending"),
    COMPLETED(2, "Completed");

    private final int code;
    private final String label;

    TaskStatus(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return the matching status, or {@code null} for values this client does not know.
     */
    @JsonCreator
    public static TaskStatus fromValue(Object value) {
        if (value instanceof Number) {
            int number = ((Number) value).intValue();
            for (TaskStatus status : values()) {
                if (status.code == number) {
                    return status;
                }
            }
            return null;
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            for (TaskStatus status : values()) {
                if (status.label.equalsIgnoreCase(trimmed) || Integer.toString(status.code).equals(trimmed)) {
                    return status;
                }
            }
        }
        return null;
    }
}
