package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Run of a long-running (orchestrated) process, as reported by the process instance service.
 */
public record ProcessInstance(
    String instanceId,
    String instanceDisplayName,
    String packageKey,
    String packageId,
    String packageVersion,
    String processKey,
    String folderKey,
    String latestRunId,
    String latestRunStatus,
    Long userId,
    String startedByUser,
    String creatorUserKey,
    String source,
    Instant startedTime,
    Instant completedTime
) {
}
