package com.mediagen.orchestrator.support;

import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.ConcurrentJobUpdateException;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.repository.JobStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * {@link JobStore} over a map, with the same conditional-update contract as the
 * JPA store. update() is serialized so concurrent attempts see each other's writes.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Job create(Job job) {
        if (job.getId() == null) {
            TestJobs.setId(job, UUID.randomUUID());
        }
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public Optional<Job> findById(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized Job update(UUID id, Set<JobStatus> expected, Consumer<Job> mutation) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        if (!expected.contains(job.getStatus())) {
            throw new ConcurrentJobUpdateException(id, expected, job.getStatus());
        }
        mutation.accept(job);
        return job;
    }

    @Override
    public List<Job> list(JobStatus status, int limit, int offset) {
        return jobs.values().stream()
                .filter(j -> status == null || j.getStatus() == status)
                .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public List<Job> findReclaimable(Instant cutoff) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.COMPLETED)
                .filter(j -> j.getCompletedAt() != null && j.getCompletedAt().isBefore(cutoff))
                .filter(Job::hasResultFile)
                .sorted(Comparator.comparing(Job::getCompletedAt))
                .toList();
    }
}
