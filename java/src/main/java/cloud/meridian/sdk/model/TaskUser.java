package cloud.meridian.sdk.model;

public record TaskUser(
    Long id,
    String name,
    String surname,
    String userName,
    String emailAddress,
    String displayName
) {
}
