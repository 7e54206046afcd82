package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Action Center task as listed across folders.
 */
public record Task(
    Long id,
    String key,
    String title,
    String type,
    String priority,
    TaskStatus status,
    Long folderId,
    String action,
    String externalTag,
    String taskAssigneeName,
    TaskUser assignedToUser,
    TaskUser creatorUser,
    TaskUser lastModifierUser,
    Instant createdTime,
    Instant lastAssignedTime,
    Instant lastModifiedTime,
    Instant completedTime
) {
}
