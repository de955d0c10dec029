package com.mediagen.orchestrator.repository;

import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link JobStore} backed by the jobs table.
 *
 * update() runs in its own transaction: SELECT ... FOR UPDATE, check the status,
 * mutate, flush. The @Version column catches writers that bypass this path.
 */
@Component
public class JpaJobStore implements JobStore {

    private final JobRepository jobRepo;
    private final EntityManager entityManager;

    public JpaJobStore(JobRepository jobRepo, EntityManager entityManager) {
        this.jobRepo       = jobRepo;
        this.entityManager = entityManager;
    }

    @Override
    @Transactional
    public Job create(Job job) {
        return jobRepo.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    @Override
    @Transactional
    public Job update(UUID id, Set<JobStatus> expected, Consumer<Job> mutation) {
        Job job = jobRepo.findForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
        if (!expected.contains(job.getStatus())) {
            throw new ConcurrentJobUpdateException(id, expected, job.getStatus());
        }
        mutation.accept(job);
        return jobRepo.saveAndFlush(job);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> list(JobStatus status, int limit, int offset) {
        TypedQuery<Job> query = status == null
                ? entityManager.createQuery("SELECT j FROM Job j ORDER BY j.createdAt DESC", Job.class)
                : entityManager.createQuery(
                        "SELECT j FROM Job j WHERE j.status = :status ORDER BY j.createdAt DESC", Job.class)
                        .setParameter("status", status);
        return query.setFirstResult(offset).setMaxResults(limit).getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> findReclaimable(Instant cutoff) {
        return jobRepo.findReclaimable(cutoff);
    }
}
