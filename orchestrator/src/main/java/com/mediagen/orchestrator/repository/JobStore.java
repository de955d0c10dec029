package com.mediagen.orchestrator.repository;

import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable record of jobs as seen by the orchestrator and the retention sweep.
 *
 * Every mutation of an existing job goes through {@link #update}, which is a
 * read-modify-write guarded by the job's current status.
 */
public interface JobStore {

    Job create(Job job);

    Optional<Job> findById(UUID id);

    /**
     * Apply {@code mutation} to the job if its status is one of {@code expected}.
     *
     * @return the job as persisted after the mutation
     * @throws JobNotFoundException          if the job does not exist
     * @throws ConcurrentJobUpdateException  if the status is not in {@code expected}; nothing is written
     */
    Job update(UUID id, Set<JobStatus> expected, Consumer<Job> mutation);

    /** Newest first; {@code status} may be null for all statuses. */
    List<Job> list(JobStatus status, int limit, int offset);

    /** COMPLETED jobs finished before {@code cutoff} that still reference an artifact. */
    List<Job> findReclaimable(Instant cutoff);
}
