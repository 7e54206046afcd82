package cloud.meridian.sdk.model;

import java.time.Instant;

/**
 * Metadata of one file stored in a bucket.
 *
 * @param path         full path of the file inside the bucket.
 * @param size         size in bytes.
 * @param lastModified {@code null} when the storage provider does not report it.
 */
public record BlobItem(
    String path,
    String contentType,
    Long size,
    Instant lastModified
) {
}
