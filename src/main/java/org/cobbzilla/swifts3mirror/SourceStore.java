package org.cobbzilla.swifts3mirror;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Read-only access to the container objects are mirrored from. Implementations must be safe for
 * concurrent use by all transfer workers.
 */
public interface SourceStore {

    /**
     * Lists the page of objects that follows {@code marker} (or the first page when it is null).
     * An empty page means the listing is complete.
     *
     * @throws StoreException if the container cannot be listed
     */
    List<KeyObjectSummary> listObjects(String container, String marker);

    /**
     * Writes the full content of an object to {@code target}, replacing any existing file.
     */
    void download(String container, String key, Path target) throws IOException;
}
