package org.cobbzilla.swifts3mirror;

import java.nio.file.Path;

/**
 * Access to the bucket objects are mirrored into. Implementations must be safe for concurrent use
 * by all transfer workers, and signal expired credentials with {@link CredentialsExpiredException}.
 */
public interface DestinationStore {

    boolean bucketExists(String bucket);

    /**
     * @param continuationToken null for the first page
     */
    KeyListing listObjects(String bucket, String continuationToken);

    /**
     * @return the ETag the store reports for the key, possibly quoted
     * @throws ObjectNotFoundException if the key does not exist
     */
    String getObjectETag(String bucket, String key) throws ObjectNotFoundException;

    void upload(String bucket, String key, Path file, BandwidthThrottle throttle);

    /**
     * Creates a zero-byte object, used for directory markers.
     */
    void createMarker(String bucket, String key);
}
