package com.mediagen.orchestrator.storage;

import java.util.UUID;

/** Thrown when an artifact or its metadata record does not exist. Never retried. */
public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(UUID jobId, String what) {
        super(what + " not found for job " + jobId);
    }
}
