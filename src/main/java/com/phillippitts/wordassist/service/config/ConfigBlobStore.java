package com.phillippitts.wordassist.service.config;

import java.util.Optional;

/**
 * Persistent storage of the single configuration blob.
 *
 * <p>Writes replace the whole blob. There is no concurrency token; the last writer wins.
 */
public interface ConfigBlobStore {

    /**
     * @return the stored blob, or empty when nothing has been written yet
     */
    Optional<String> read();

    /**
     * Replaces the stored blob.
     *
     * @param blob serialized configuration
     */
    void write(String blob);

    /**
     * Opaque value that changes whenever the blob is rewritten, by this or another process.
     *
     * @return modification stamp, 0 when the blob does not exist
     */
    long modificationStamp();

    /** Human-readable location for log messages. */
    String describe();
}
