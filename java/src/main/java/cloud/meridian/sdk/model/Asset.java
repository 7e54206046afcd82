package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Orchestrator asset: a named value (text, integer, boolean or credential) stored per folder.
 */
public record Asset(
    Long id,
    String key,
    String name,
    String valueScope,
    String valueType,
    String value,
    String description,
    Boolean canBeDeleted,
    Boolean hasDefaultValue,
    Integer foldersCount,
    Long creatorUserId,
    Long lastModifierUserId,
    Instant createdTime,
    Instant lastModifiedTime
) {
}
