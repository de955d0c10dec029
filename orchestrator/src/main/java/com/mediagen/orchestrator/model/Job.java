package com.mediagen.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One image generation request and its progress through the {@link JobStatus} lifecycle.
 *
 * Created by the request handler in PENDING, mutated only by the orchestrator
 * (status, handle, timestamps, result/error) and by the retention sweep (result only).
 * Jobs are never deleted; terminal rows are the history.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    static final int MAX_ERROR_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 2000, updatable = false)
    private String prompt;

    @Column(name = "model_name", nullable = false, updatable = false)
    private String modelName;

    // Raw JSON object of generation parameters; parsed by GenerationInput.
    @Column(length = 4000, updatable = false)
    private String parameters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    // Assigned by the generation service on submit. Once set it never changes:
    // its presence is what makes a resumed attempt skip resubmission.
    @Column(name = "external_handle")
    private String externalHandle;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Embedded
    private JobResult result;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String prompt, String modelName, String parameters, Instant createdAt) {
        this.prompt     = prompt;
        this.modelName  = modelName;
        this.parameters = parameters;
        this.createdAt  = createdAt;
        this.updatedAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Lifecycle mutations
    // ------------------------------------------------------------------

    /**
     * Move to {@code target}, stamping started_at on the first entry into PROCESSING
     * and completed_at on entry into a terminal state.
     *
     * @throws InvalidTransitionException if the edge is not in the graph; nothing is modified
     */
    public void transitionTo(JobStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target);
        }
        if (target == JobStatus.PROCESSING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal()) {
            completedAt = now;
        }
        status    = target;
        updatedAt = now;
    }

    /** Count one orchestration attempt that found the job still active. */
    public void recordAttempt() {
        retryCount++;
    }

    /**
     * Record the generation service's handle.
     *
     * @throws IllegalStateException if a different handle is already recorded
     */
    public void assignExternalHandle(String handle, Instant now) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("External handle must not be blank");
        }
        if (externalHandle != null && !externalHandle.equals(handle)) {
            throw new IllegalStateException("Job %s already has external handle %s, refusing %s"
                    .formatted(id, externalHandle, handle));
        }
        externalHandle = handle;
        updatedAt      = now;
    }

    public void complete(JobResult result, Instant now) {
        transitionTo(JobStatus.COMPLETED, now);
        this.result = result;
    }

    public void fail(String message, Instant now) {
        transitionTo(JobStatus.FAILED, now);
        this.errorMessage = message != null && message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH)
                : message;
    }

    /** Drop the artifact reference after its file has been reclaimed. Status is untouched. */
    /** @return false if the result was already cleared */
    public boolean clearResult(Instant now) {
        if (result == null) {
            return false;
        }
        result    = null;
        updatedAt = now;
        return true;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID      getId()             { return id; }
    public String    getPrompt()         { return prompt; }
    public String    getModelName()      { return modelName; }
    public String    getParameters()     { return parameters; }
    public JobStatus getStatus()         { return status; }
    public String    getExternalHandle() { return externalHandle; }
    public int       getRetryCount()     { return retryCount; }
    public String    getErrorMessage()   { return errorMessage; }
    public JobResult getResult()         { return result; }
    public Instant   getCreatedAt()      { return createdAt; }
    public Instant   getUpdatedAt()      { return updatedAt; }
    public Instant   getStartedAt()      { return startedAt; }
    public Instant   getCompletedAt()    { return completedAt; }
    public long      getVersion()        { return version; }

    public boolean hasExternalHandle() {
        return externalHandle != null && !externalHandle.isBlank();
    }

    public boolean hasResultFile() {
        return result != null && result.getPath() != null;
    }
}
