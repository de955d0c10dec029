package com.mediagen.orchestrator.api.dto;

import com.mediagen.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for job creation, status and listing.
 * resultUrl and resultSizeBytes are null until the job completes, and again after
 * its artifact has been reclaimed.
 */
public record JobResponse(
        UUID    id,
        String  status,
        String  prompt,
        String  modelName,
        String  externalJobId,
        int     retryCount,
        String  errorMessage,
        String  resultUrl,
        Long    resultSizeBytes,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getStatus().name(),
                job.getPrompt(),
                job.getModelName(),
                job.getExternalHandle(),
                job.getRetryCount(),
                job.getErrorMessage(),
                job.getResult() != null ? job.getResult().getUrl()       : null,
                job.getResult() != null ? job.getResult().getSizeBytes() : null,
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
