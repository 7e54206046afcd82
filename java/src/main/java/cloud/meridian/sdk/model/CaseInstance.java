package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Run of a case management process. {@code caseId} is the external identifier the case was opened with.
 */
public record CaseInstance(
    String instanceId,
    String instanceDisplayName,
    String caseId,
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
