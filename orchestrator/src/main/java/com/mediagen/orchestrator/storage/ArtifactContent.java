package com.mediagen.orchestrator.storage;

import java.util.UUID;

/** Bytes of a stored artifact with the extension it was stored under. */
public record ArtifactContent(byte[] data, String extension) {

    public String fileName(UUID jobId) {
        return jobId + "." + extension;
    }
}
