package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.config.OrchestrationProperties;
import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.ConcurrentJobUpdateException;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.repository.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process invoking layer for the orchestrator.
 *
 * enqueue() hands a job id to a fixed worker pool; each worker runs one
 * {@link JobOrchestrator#advance} call with blocking I/O. A RETRYABLE outcome is
 * re-enqueued after the {@link RetryPolicy} backoff, until the job's retry budget
 * is spent and it is forced to FAILED.
 *
 * On startup every PENDING or PROCESSING job is enqueued again, so work interrupted
 * by a crash or restart resumes where its last attempt left it.
 */
@Component
public class OrchestrationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationDispatcher.class);

    private static final int RESUME_PAGE_SIZE = 100;

    private final JobOrchestrator          orchestrator;
    private final JobStore                 jobStore;
    private final RetryPolicy              retryPolicy;
    private final Clock                    clock;
    private final ExecutorService          workers;
    private final ScheduledExecutorService timer;

    public OrchestrationDispatcher(JobOrchestrator orchestrator,
                                   JobStore jobStore,
                                   RetryPolicy retryPolicy,
                                   OrchestrationProperties properties,
                                   Clock clock) {
        this.orchestrator = orchestrator;
        this.jobStore     = jobStore;
        this.retryPolicy  = retryPolicy;
        this.clock        = clock;
        this.workers      = Executors.newFixedThreadPool(properties.getWorkers());
        this.timer        = Executors.newSingleThreadScheduledExecutor();
    }

    /** Run an attempt for this job as soon as a worker is free. */
    public void enqueue(UUID jobId) {
        workers.execute(() -> {
            try {
                runAttempt(jobId);
            } catch (RuntimeException e) {
                log.error("Attempt task for job {} crashed", jobId, e);
            }
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeActiveJobs() {
        int resumed = 0;
        for (JobStatus status : List.of(JobStatus.PROCESSING, JobStatus.PENDING)) {
            for (int offset = 0; ; offset += RESUME_PAGE_SIZE) {
                List<Job> page = jobStore.list(status, RESUME_PAGE_SIZE, offset);
                page.forEach(job -> enqueue(job.getId()));
                resumed += page.size();
                if (page.size() < RESUME_PAGE_SIZE) {
                    break;
                }
            }
        }
        if (resumed > 0) {
            log.info("Resumed {} unfinished jobs", resumed);
        }
    }

    @PreDestroy
    public void shutdown() {
        timer.shutdownNow();
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Attempt handling
    // ------------------------------------------------------------------

    void runAttempt(UUID jobId) {
        OrchestrationOutcome outcome;
        try {
            outcome = orchestrator.advance(jobId);
        } catch (JobNotFoundException e) {
            log.error("Dropping job {}: {}", jobId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            // Typically the job store being unavailable. The job is still active
            // in the store, so the whole attempt is simply run again later.
            log.error("Attempt for job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
            outcome = OrchestrationOutcome.retryable(FailureStage.INTERNAL.describe(e.getMessage()));
        }

        if (outcome.isRetryable()) {
            scheduleRetry(jobId, outcome.reason());
        } else {
            log.info("Job {} finished as {}", jobId, outcome.kind());
        }
    }

    void scheduleRetry(UUID jobId, String reason) {
        int attempts;
        try {
            attempts = jobStore.findById(jobId).map(Job::getRetryCount).orElse(0);
        } catch (RuntimeException e) {
            // The budget is unknown while the store is down; the next attempt records it.
            log.warn("Could not read retry budget of job {}, retrying anyway: {}", jobId, e.getMessage());
            reschedule(jobId, retryPolicy.delayFor(1));
            return;
        }
        if (retryPolicy.isExhausted(attempts)) {
            forceFail(jobId, attempts, reason);
            return;
        }
        Duration delay = retryPolicy.delayFor(Math.max(1, attempts));
        log.info("Job {} will be retried in {} (attempt {}/{}): {}",
                jobId, delay, attempts, retryPolicy.getMaxRetries(), reason);
        reschedule(jobId, delay);
    }

    private void reschedule(UUID jobId, Duration delay) {
        try {
            timer.schedule(() -> enqueue(jobId), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.info("Dispatcher is shutting down, job {} resumes on next startup", jobId);
        }
    }

    private void forceFail(UUID jobId, int attempts, String reason) {
        String message = FailureStage.INTERNAL.describe(
                "max retries exceeded after %d attempts, last error: %s".formatted(attempts, reason));
        try {
            jobStore.update(jobId, Set.of(JobStatus.PROCESSING), j -> j.fail(message, Instant.now(clock)));
            log.error("Job {} FAILED: {}", jobId, message);
        } catch (ConcurrentJobUpdateException e) {
            log.warn("Job {} is {} and was not force-failed", jobId, e.getActual());
        } catch (JobNotFoundException e) {
            log.error("Dropping job {}: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not force-fail job {}, retrying: {}", jobId, e.getMessage());
            reschedule(jobId, retryPolicy.delayFor(attempts));
        }
    }
}
