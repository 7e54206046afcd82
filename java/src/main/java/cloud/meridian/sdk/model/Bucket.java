package cloud.meridian.sdk.model;

/**
 * Storage bucket registered in Orchestrator.
 */
public record Bucket(
    Long id,
    String name,
    String description,
    String identifier,
    String storageProvider,
    String storageContainer,
    String options,
    Integer foldersCount
) {
}
