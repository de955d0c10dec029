package com.mediagen.orchestrator.repository;

import com.mediagen.orchestrator.model.JobStatus;

import java.util.Set;
import java.util.UUID;

/**
 * A conditional update found the job in a status other than the ones the caller expected:
 * someone else changed it between the caller's read and its write.
 */
public class ConcurrentJobUpdateException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus actual;

    public ConcurrentJobUpdateException(UUID jobId, Set<JobStatus> expected, JobStatus actual) {
        super("Job %s expected in %s but was %s".formatted(jobId, expected, actual));
        this.jobId  = jobId;
        this.actual = actual;
    }

    public UUID      getJobId()  { return jobId; }
    public JobStatus getActual() { return actual; }
}
