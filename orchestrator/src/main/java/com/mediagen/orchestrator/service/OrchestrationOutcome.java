package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.model.JobStatus;

/**
 * What one {@link JobOrchestrator#advance} call achieved.
 *
 * RETRYABLE asks the invoking layer to call advance again later; reason explains why.
 * The other kinds mirror the job's terminal status.
 */
public record OrchestrationOutcome(Kind kind, String reason) {

    public enum Kind { COMPLETED, FAILED, CANCELLED, RETRYABLE }

    public static OrchestrationOutcome completed() {
        return new OrchestrationOutcome(Kind.COMPLETED, null);
    }

    public static OrchestrationOutcome failed(String reason) {
        return new OrchestrationOutcome(Kind.FAILED, reason);
    }

    public static OrchestrationOutcome cancelled() {
        return new OrchestrationOutcome(Kind.CANCELLED, null);
    }

    public static OrchestrationOutcome retryable(String reason) {
        return new OrchestrationOutcome(Kind.RETRYABLE, reason);
    }

    /** Outcome matching a terminal job status. */
    public static OrchestrationOutcome ofTerminal(JobStatus status, String errorMessage) {
        return switch (status) {
            case COMPLETED -> completed();
            case FAILED    -> failed(errorMessage);
            case CANCELLED -> cancelled();
            case PENDING, PROCESSING -> throw new IllegalArgumentException(status + " is not terminal");
        };
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }
}
