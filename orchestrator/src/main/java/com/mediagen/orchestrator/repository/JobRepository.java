package com.mediagen.orchestrator.repository;

import com.mediagen.orchestrator.model.Job;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and hold a row lock until the surrounding transaction ends.
     * Conditional updates run inside that window.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findForUpdate(@Param("id") UUID id);

    /** Completed jobs still holding an artifact reference, finished before the cutoff. */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.mediagen.orchestrator.model.JobStatus.COMPLETED
              AND j.completedAt < :cutoff
              AND j.result.path IS NOT NULL
            ORDER BY j.completedAt ASC
            """)
    List<Job> findReclaimable(@Param("cutoff") Instant cutoff);
}
