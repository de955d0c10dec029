package com.mediagen.orchestrator.storage;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Durable storage for generated artifacts and their metadata, keyed by job id.
 *
 * Writes overwrite by key, so repeating a write after a crash is harmless.
 */
public interface ArtifactStore {

    String DEFAULT_EXTENSION = "png";

    /**
     * Store the artifact bytes for a job.
     *
     * @param extension file extension without the dot, e.g. "png"
     * @throws StorageException if the write fails
     */
    StoredArtifact put(UUID jobId, byte[] data, String extension);

    /**
     * Store the generation metadata record for a job.
     *
     * @return path of the metadata record
     * @throws StorageException if the write fails
     */
    String putMetadata(UUID jobId, Map<String, Object> metadata);

    /** @throws ArtifactNotFoundException if no artifact exists for the key */
    byte[] get(UUID jobId, String extension);

    /** @throws ArtifactNotFoundException if no metadata record exists */
    Map<String, Object> getMetadata(UUID jobId);

    /** @return false if there was nothing to delete; absence is never an error */
    boolean delete(UUID jobId, String extension);

    /**
     * File extension of a stored path or an output URL, ignoring any query string.
     * Falls back to "png" when the name carries no usable extension.
     */
    static String extensionOf(String pathOrUrl) {
        if (pathOrUrl == null) {
            return DEFAULT_EXTENSION;
        }
        String name = pathOrUrl;
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.matches("[a-z0-9]{1,5}") ? ext : DEFAULT_EXTENSION;
    }
}
