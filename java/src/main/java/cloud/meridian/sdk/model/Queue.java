package cloud.meridian.sdk.model;

import java.time.Instant;

public record Queue(
    Long id,
    String key,
    String name,
    String description,
    Integer maxNumberOfRetries,
    Boolean acceptAutomaticallyRetry,
    Boolean enforceUniqueReference,
    Boolean encrypted,
    Integer slaInMinutes,
    Integer riskSlaInMinutes,
    Long folderId,
    String folderName,
    Instant createdTime
) {
}
