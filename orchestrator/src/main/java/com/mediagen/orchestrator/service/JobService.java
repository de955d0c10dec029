package com.mediagen.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.config.GenerationProperties;
import com.mediagen.orchestrator.generation.GenerationInput;
import com.mediagen.orchestrator.model.InvalidTransitionException;
import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.ConcurrentJobUpdateException;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.repository.JobStore;
import com.mediagen.orchestrator.storage.ArtifactContent;
import com.mediagen.orchestrator.storage.ArtifactNotFoundException;
import com.mediagen.orchestrator.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-side operations on jobs: create, look up, list, cancel, and read results.
 *
 * Creating a job only records it as PENDING and hands its id to the dispatcher;
 * all generation work happens in {@link JobOrchestrator}.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int MAX_PROMPT_LENGTH = 2000;
    static final int MAX_PAGE_SIZE     = 100;

    private final JobStore                jobStore;
    private final ArtifactStore           artifactStore;
    private final OrchestrationDispatcher dispatcher;
    private final GenerationProperties    generationProperties;
    private final ObjectMapper            objectMapper;
    private final Clock                   clock;

    public JobService(JobStore jobStore,
                      ArtifactStore artifactStore,
                      OrchestrationDispatcher dispatcher,
                      GenerationProperties generationProperties,
                      ObjectMapper objectMapper,
                      Clock clock) {
        this.jobStore             = jobStore;
        this.artifactStore        = artifactStore;
        this.dispatcher           = dispatcher;
        this.generationProperties = generationProperties;
        this.objectMapper         = objectMapper;
        this.clock                = clock;
    }

    // ------------------------------------------------------------------
    // Job creation
    // ------------------------------------------------------------------

    /**
     * Record a new PENDING job and schedule its first attempt.
     *
     * @param model      may be null or blank for the configured default model
     * @param parameters generation parameters, may be null
     * @throws IllegalArgumentException if the prompt or the parameters are invalid
     */
    public Job create(String prompt, String model, Map<String, Object> parameters) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException(
                    "Prompt must be at most " + MAX_PROMPT_LENGTH + " characters");
        }
        String modelName = (model == null || model.isBlank()) ? generationProperties.getDefaultModel() : model;

        String parametersJson = null;
        if (parameters != null && !parameters.isEmpty()) {
            try {
                parametersJson = objectMapper.writeValueAsString(parameters);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Parameters are not serializable: " + e.getMessage(), e);
            }
            // Reject bad knobs now rather than on the first attempt.
            GenerationInput.parse(prompt, parametersJson, objectMapper);
        }

        Job job = jobStore.create(new Job(prompt, modelName, parametersJson, Instant.now(clock)));
        log.info("Created job {} for model {}", job.getId(), modelName);
        dispatcher.enqueue(job.getId());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Job> findById(UUID id) {
        return jobStore.findById(id);
    }

    /** @param status null for all statuses */
    public List<Job> list(JobStatus status, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return jobStore.list(status, limit, offset);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel a PENDING or PROCESSING job. A running attempt notices at its next poll.
     *
     * @throws JobNotFoundException       if the job does not exist
     * @throws InvalidTransitionException if the job is already terminal
     */
    public Job cancel(UUID id) {
        try {
            Job job = jobStore.update(id, JobStatus.ACTIVE,
                    j -> j.transitionTo(JobStatus.CANCELLED, Instant.now(clock)));
            log.info("Job {} CANCELLED", id);
            return job;
        } catch (ConcurrentJobUpdateException e) {
            throw new InvalidTransitionException(id, e.getActual(), JobStatus.CANCELLED);
        }
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    /**
     * Bytes of a completed job's artifact and the extension they were stored under.
     *
     * @throws JobNotFoundException      if the job does not exist
     * @throws IllegalStateException     if the job is not COMPLETED
     * @throws ArtifactNotFoundException if the artifact was never stored or was reclaimed
     */
    public ArtifactContent readArtifact(UUID id) {
        Job job = jobStore.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Job " + id + " is " + job.getStatus() + ", not COMPLETED");
        }
        if (!job.hasResultFile()) {
            throw new ArtifactNotFoundException(id, "artifact");
        }
        String extension = ArtifactStore.extensionOf(job.getResult().getPath());
        return new ArtifactContent(artifactStore.get(id, extension), extension);
    }

    /**
     * @throws JobNotFoundException      if the job does not exist
     * @throws ArtifactNotFoundException if no metadata was written for the job
     */
    public Map<String, Object> readMetadata(UUID id) {
        jobStore.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        return artifactStore.getMetadata(id);
    }
}
