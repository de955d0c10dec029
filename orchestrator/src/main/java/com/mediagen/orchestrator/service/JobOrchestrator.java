package com.mediagen.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.config.OrchestrationProperties;
import com.mediagen.orchestrator.generation.GenerationClient;
import com.mediagen.orchestrator.generation.GenerationInput;
import com.mediagen.orchestrator.generation.PollResult;
import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobResult;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.ConcurrentJobUpdateException;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.repository.JobStore;
import com.mediagen.orchestrator.storage.ArtifactStore;
import com.mediagen.orchestrator.storage.StoredArtifact;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives one job through its lifecycle.
 *
 * Each {@link #advance} call is one attempt. It resumes from whatever the previous
 * attempts left behind:
 *
 *   1. terminal job            → return its status, touch nothing
 *   2. take the job's lease    → PENDING/PROCESSING → PROCESSING, retry_count + 1
 *   3. no external handle yet  → submit, persist the handle before anything else
 *   4. poll the handle (bounded), then download + store the artifact → COMPLETED
 *
 * Because the handle is persisted as soon as it exists, an attempt that crashes
 * after submission resumes at step 4 and never submits again. The artifact write
 * is overwrite-by-key, so redoing it after a crash is harmless.
 *
 * Failures come back as RETRYABLE (the caller reschedules, see RetryPolicy) or are
 * recorded on the job as FAILED. Only a failure of the job store itself escapes
 * as an exception; the job then stays PROCESSING and the next attempt redoes the
 * unfinished step.
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private static final Set<JobStatus> PROCESSING_ONLY = Set.of(JobStatus.PROCESSING);

    private final JobStore         jobStore;
    private final GenerationClient generationClient;
    private final ArtifactStore    artifactStore;
    private final JobLease         jobLease;
    private final RetryPolicy      retryPolicy;
    private final ObjectMapper     objectMapper;
    private final MeterRegistry    meterRegistry;
    private final Clock            clock;

    private final Duration pollInterval;
    private final int      maxPollAttempts;
    private final Duration leaseTtl;

    public JobOrchestrator(JobStore jobStore,
                           GenerationClient generationClient,
                           ArtifactStore artifactStore,
                           JobLease jobLease,
                           RetryPolicy retryPolicy,
                           OrchestrationProperties properties,
                           ObjectMapper objectMapper,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.jobStore         = jobStore;
        this.generationClient = generationClient;
        this.artifactStore    = artifactStore;
        this.jobLease         = jobLease;
        this.retryPolicy      = retryPolicy;
        this.objectMapper     = objectMapper;
        this.meterRegistry    = meterRegistry;
        this.clock            = clock;
        this.pollInterval     = properties.getPollInterval();
        this.maxPollAttempts  = properties.getMaxPollAttempts();
        this.leaseTtl         = properties.getLeaseTtl();
        if (maxPollAttempts < 1) {
            throw new IllegalArgumentException("mediagen.orchestration.max-poll-attempts must be >= 1");
        }
        Duration longestAttempt = properties.longestAttempt();
        if (leaseTtl.compareTo(longestAttempt) <= 0) {
            throw new IllegalArgumentException("mediagen.orchestration.lease-ttl (" + leaseTtl
                    + ") must be longer than the longest attempt (" + longestAttempt + ")");
        }
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Advance the job as far as possible in one attempt.
     *
     * @throws JobNotFoundException if no job has this id
     * @throws org.springframework.dao.DataAccessException if the job store is unavailable
     */
    public OrchestrationOutcome advance(UUID jobId) {
        MDC.put("jobId", jobId.toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcomeTag = "error";
        try {
            OrchestrationOutcome outcome = doAdvance(jobId);
            outcomeTag = outcome.kind().name().toLowerCase();
            return outcome;
        } finally {
            sample.stop(meterRegistry.timer("mediagen.orchestration.duration"));
            meterRegistry.counter("mediagen.orchestration.outcomes", "outcome", outcomeTag).increment();
            MDC.remove("attempt");
            MDC.remove("jobId");
        }
    }

    private OrchestrationOutcome doAdvance(UUID jobId) {
        Job job = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        // Duplicate delivery after the job finished, or cancelled before we got here.
        if (job.getStatus().isTerminal()) {
            log.info("Job {} is already {}, nothing to do", jobId, job.getStatus());
            return OrchestrationOutcome.ofTerminal(job.getStatus(), job.getErrorMessage());
        }

        Optional<JobLease.Held> lease = jobLease.tryAcquire(jobId, leaseTtl);
        if (lease.isEmpty()) {
            log.info("Job {} is being advanced by another worker, deferring", jobId);
            return OrchestrationOutcome.retryable("lease held by another worker");
        }
        try (JobLease.Held held = lease.get()) {
            return runAttempt(held.jobId());
        }
    }

    private OrchestrationOutcome runAttempt(UUID jobId) {
        Job job;
        try {
            job = jobStore.update(jobId, JobStatus.ACTIVE, j -> {
                j.transitionTo(JobStatus.PROCESSING, now());
                j.recordAttempt();
            });
        } catch (ConcurrentJobUpdateException e) {
            // Cancelled (or finished by someone else) between our read and the lease.
            return currentTerminalOutcome(jobId);
        }
        MDC.put("attempt", String.valueOf(job.getRetryCount()));
        log.info("Attempt {} for job {} (handle={})", job.getRetryCount(), jobId, job.getExternalHandle());

        if (!job.hasExternalHandle()) {
            Optional<OrchestrationOutcome> stopped = submit(job);
            if (stopped.isPresent()) {
                return stopped.get();
            }
            job = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        } else {
            log.info("Job {} resumes polling prediction {}", jobId, job.getExternalHandle());
        }
        return pollUntilDone(job);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** @return a final outcome if the attempt must stop here, empty once the handle is persisted */
    private Optional<OrchestrationOutcome> submit(Job job) {
        UUID jobId = job.getId();

        CallOutcome<GenerationInput> parsed = call(FailureStage.SUBMISSION,
                () -> GenerationInput.parse(job.getPrompt(), job.getParameters(), objectMapper));
        if (parsed instanceof CallOutcome.Failure<GenerationInput> failure) {
            return Optional.of(onFailure(jobId, failure));
        }
        GenerationInput input = ((CallOutcome.Success<GenerationInput>) parsed).value();

        CallOutcome<String> submitted = call(FailureStage.SUBMISSION,
                () -> generationClient.submit(job.getModelName(), input));
        if (submitted instanceof CallOutcome.Failure<String> failure) {
            return Optional.of(onFailure(jobId, failure));
        }
        String handle = ((CallOutcome.Success<String>) submitted).value();

        // Resumption checkpoint: from here on no attempt may submit this job again.
        try {
            jobStore.update(jobId, PROCESSING_ONLY, j -> j.assignExternalHandle(handle, now()));
        } catch (ConcurrentJobUpdateException e) {
            log.warn("Job {} left PROCESSING while prediction {} was being submitted", jobId, handle);
            return Optional.of(currentTerminalOutcome(jobId));
        }
        log.info("Job {} submitted as prediction {}", jobId, handle);

        writeMetadata(job, input, handle);
        return Optional.empty();
    }

    private void writeMetadata(Job job, GenerationInput input, String handle) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("prompt",          job.getPrompt());
        metadata.put("model_name",      job.getModelName());
        metadata.put("external_job_id", handle);
        metadata.put("created_at",      job.getCreatedAt().toString());
        metadata.put("parameters",      input.toPayload());

        CallOutcome<String> written = call(FailureStage.STORAGE,
                () -> artifactStore.putMetadata(job.getId(), metadata));
        if (written instanceof CallOutcome.Failure<String> failure) {
            // Metadata is informational; the generation itself goes on.
            log.warn("Could not write metadata for job {}: {}", job.getId(), failure.message());
        }
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    private OrchestrationOutcome pollUntilDone(Job job) {
        UUID   jobId  = job.getId();
        String handle = job.getExternalHandle();

        for (int poll = 1; poll <= maxPollAttempts; poll++) {
            if (poll > 1) {
                if (!sleep(pollInterval)) {
                    return OrchestrationOutcome.retryable("interrupted while waiting for prediction " + handle);
                }
                // Cancellation is honoured between polls, never mid-call.
                Optional<OrchestrationOutcome> stopped = checkStillProcessing(jobId);
                if (stopped.isPresent()) {
                    return stopped.get();
                }
            }

            CallOutcome<PollResult> polled = call(FailureStage.GENERATION, () -> generationClient.poll(handle));
            if (polled instanceof CallOutcome.Failure<PollResult> failure) {
                return onFailure(jobId, failure);
            }
            PollResult result = ((CallOutcome.Success<PollResult>) polled).value();

            switch (result.status()) {
                case SUCCEEDED:
                    return materialize(jobId, handle, result);
                case FAILED:
                    return failJob(jobId, FailureStage.GENERATION.describe(
                            result.error() != null ? result.error() : "prediction " + handle + " failed"));
                case PROCESSING:
                    log.debug("Prediction {} still processing (poll {}/{})", handle, poll, maxPollAttempts);
                    break;
            }
        }

        return failJob(jobId, FailureStage.TIMEOUT.describe(
                "prediction %s not finished after %d polls".formatted(handle, maxPollAttempts)));
    }

    private Optional<OrchestrationOutcome> checkStillProcessing(UUID jobId) {
        Job current = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.getStatus() == JobStatus.PROCESSING) {
            return Optional.empty();
        }
        log.info("Job {} became {} while polling, stopping", jobId, current.getStatus());
        return Optional.of(OrchestrationOutcome.ofTerminal(current.getStatus(), current.getErrorMessage()));
    }

    // ------------------------------------------------------------------
    // Result materialization
    // ------------------------------------------------------------------

    private OrchestrationOutcome materialize(UUID jobId, String handle, PollResult result) {
        String outputUrl = result.firstOutput();
        if (outputUrl == null) {
            return failJob(jobId, FailureStage.GENERATION.describe(
                    "missing output, prediction " + handle + " succeeded without any output URL"));
        }

        CallOutcome<byte[]> fetched = call(FailureStage.DOWNLOAD, () -> generationClient.fetch(outputUrl));
        if (fetched instanceof CallOutcome.Failure<byte[]> failure) {
            return onFailure(jobId, failure);
        }
        byte[] data = ((CallOutcome.Success<byte[]>) fetched).value();

        String extension = ArtifactStore.extensionOf(outputUrl);
        CallOutcome<StoredArtifact> stored = call(FailureStage.STORAGE,
                () -> artifactStore.put(jobId, data, extension));
        if (stored instanceof CallOutcome.Failure<StoredArtifact> failure) {
            return onFailure(jobId, failure);
        }
        StoredArtifact artifact = ((CallOutcome.Success<StoredArtifact>) stored).value();

        try {
            jobStore.update(jobId, PROCESSING_ONLY, j -> j.complete(
                    new JobResult(artifact.path(), artifact.url(), data.length), now()));
        } catch (ConcurrentJobUpdateException e) {
            log.warn("Job {} became {} before its result was recorded; discarding artifact",
                    jobId, e.getActual());
            discardArtifact(jobId, extension);
            return currentTerminalOutcome(jobId);
        }
        log.info("Job {} COMPLETED: {} ({} bytes)", jobId, artifact.url(), data.length);
        return OrchestrationOutcome.completed();
    }

    private void discardArtifact(UUID jobId, String extension) {
        CallOutcome<Boolean> deleted = call(FailureStage.STORAGE, () -> artifactStore.delete(jobId, extension));
        if (deleted instanceof CallOutcome.Failure<Boolean> failure) {
            log.warn("Orphaned artifact for job {} could not be deleted: {}", jobId, failure.message());
        }
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    /**
     * The one place collaborator exceptions are caught. Everything past this
     * boundary works with {@link CallOutcome} values.
     */
    private <T> CallOutcome<T> call(FailureStage stage, Supplier<T> action) {
        try {
            return new CallOutcome.Success<>(action.get());
        } catch (RuntimeException e) {
            return new CallOutcome.Failure<>(retryPolicy.classify(e), stage, e.getMessage(), e);
        }
    }

    private OrchestrationOutcome onFailure(UUID jobId, CallOutcome.Failure<?> failure) {
        if (failure.isTransient()) {
            log.warn("Job {} hit a transient failure, will retry: {}", jobId, failure.message());
            return OrchestrationOutcome.retryable(failure.message());
        }
        log.error("Job {} hit a fatal failure: {}", jobId, failure.message(), failure.cause());
        return failJob(jobId, failure.message());
    }

    private OrchestrationOutcome failJob(UUID jobId, String message) {
        try {
            jobStore.update(jobId, PROCESSING_ONLY, j -> j.fail(message, now()));
        } catch (ConcurrentJobUpdateException e) {
            log.warn("Job {} became {} before failure '{}' was recorded", jobId, e.getActual(), message);
            return currentTerminalOutcome(jobId);
        }
        log.error("Job {} FAILED: {}", jobId, message);
        return OrchestrationOutcome.failed(message);
    }

    private OrchestrationOutcome currentTerminalOutcome(UUID jobId) {
        Job current = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!current.getStatus().isTerminal()) {
            return OrchestrationOutcome.retryable("job changed concurrently, now " + current.getStatus());
        }
        return OrchestrationOutcome.ofTerminal(current.getStatus(), current.getErrorMessage());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Instant now() {
        return Instant.now(clock);
    }

    /** @return false if the thread was interrupted */
    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
