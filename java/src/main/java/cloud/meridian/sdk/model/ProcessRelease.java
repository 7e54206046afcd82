package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Process published to a folder (an Orchestrator release) together with the package it runs.
 */
public record ProcessRelease(
    Long id,
    String key,
    String name,
    String description,
    String processKey,
    String packageKey,
    String packageVersion,
    String packageType,
    Long folderId,
    String folderName,
    String folderKey,
    Instant createdTime,
    Instant lastModifiedTime
) {
}
