package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.config.RetentionProperties;
import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.ConcurrentJobUpdateException;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.repository.JobStore;
import com.mediagen.orchestrator.storage.ArtifactStore;
import com.mediagen.orchestrator.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reclaims stored artifacts of completed jobs past the retention age.
 *
 * The job stays COMPLETED; only its result reference is cleared. The orchestrator
 * never revisits a completed job's result and this class never touches status,
 * so sweeps can run alongside orchestration. Running a sweep twice is harmless:
 * a job whose result was cleared is no longer a candidate, and a file that is
 * already gone counts as reclaimed. When two sweeps race on the same job only
 * the one that clears the result counts it.
 */
@Component
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final JobStore            jobStore;
    private final ArtifactStore       artifactStore;
    private final RetentionProperties properties;
    private final Clock               clock;

    public RetentionSweeper(JobStore jobStore,
                            ArtifactStore artifactStore,
                            RetentionProperties properties,
                            Clock clock) {
        this.jobStore      = jobStore;
        this.artifactStore = artifactStore;
        this.properties    = properties;
        this.clock         = clock;
    }

    @Scheduled(fixedDelayString = "${mediagen.retention.sweep-interval:PT1H}",
               initialDelayString = "${mediagen.retention.sweep-interval:PT1H}")
    public void scheduledSweep() {
        SweepResult result = sweep(properties.getMaxAge());
        log.info("Retention sweep reclaimed {}/{} artifacts older than {}",
                result.reclaimed(), result.scanned(), properties.getMaxAge());
    }

    public SweepResult sweep(Duration olderThan) {
        Instant now    = clock.instant();
        Instant cutoff = now.minus(olderThan);
        List<Job> candidates = jobStore.findReclaimable(cutoff);

        int reclaimed = 0;
        for (Job job : candidates) {
            if (reclaim(job, now)) {
                reclaimed++;
            }
        }
        return new SweepResult(candidates.size(), reclaimed);
    }

    private boolean reclaim(Job job, Instant now) {
        String path      = job.getResult().getPath();
        String extension = ArtifactStore.extensionOf(path);
        try {
            if (!artifactStore.delete(job.getId(), extension)) {
                log.info("Artifact of job {} was already gone", job.getId());
            }
        } catch (StorageException e) {
            log.warn("Could not delete artifact of job {}, keeping its result for the next sweep: {}",
                    job.getId(), e.getMessage());
            return false;
        }

        AtomicBoolean cleared = new AtomicBoolean();
        try {
            jobStore.update(job.getId(), Set.of(JobStatus.COMPLETED), j -> cleared.set(j.clearResult(now)));
        } catch (ConcurrentJobUpdateException | JobNotFoundException e) {
            log.warn("Skipping job {} during retention sweep: {}", job.getId(), e.getMessage());
            return false;
        }
        if (!cleared.get()) {
            log.debug("Result of job {} was already cleared by another sweep", job.getId());
            return false;
        }
        log.debug("Reclaimed artifact of job {} ({})", job.getId(), path);
        return true;
    }
}
