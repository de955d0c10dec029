package com.mediagen.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a status change does not match an edge of the {@link JobStatus} graph.
 *
 * The record is left unchanged. This is how a cancellation that races a job
 * into a terminal state gets rejected, so callers must surface it, never ignore it.
 */
public class InvalidTransitionException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super("Invalid transition for job %s: %s -> %s".formatted(jobId, from, to));
        this.jobId = jobId;
        this.from  = from;
        this.to    = to;
    }

    public UUID      getJobId() { return jobId; }
    public JobStatus getFrom()  { return from; }
    public JobStatus getTo()    { return to; }
}
