package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.config.RetryProperties;
import com.mediagen.orchestrator.generation.GenerationException;
import com.mediagen.orchestrator.model.FailureKind;
import com.mediagen.orchestrator.storage.StorageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is worth another attempt of the whole job, and when.
 *
 * This is the coarse retry loop around {@link JobOrchestrator#advance}; the
 * orchestrator's own poll loop is a short, bounded wait inside a single attempt.
 */
@Component
public class RetryPolicy {

    private final Duration baseDelay;
    private final double   backoffFactor;
    private final Duration maxDelay;
    private final double   jitterRatio;
    private final int      maxRetries;

    public RetryPolicy(RetryProperties properties) {
        if (properties.getBackoffFactor() < 1.0) {
            throw new IllegalArgumentException("mediagen.retry.backoff-factor must be >= 1");
        }
        if (properties.getJitterRatio() < 0) {
            throw new IllegalArgumentException("mediagen.retry.jitter-ratio must be >= 0");
        }
        this.baseDelay     = properties.getBaseDelay();
        this.backoffFactor = properties.getBackoffFactor();
        this.maxDelay      = properties.getMaxDelay();
        this.jitterRatio   = properties.getJitterRatio();
        this.maxRetries    = properties.getMaxRetries();
    }

    /**
     * Classify a collaborator failure.
     *
     * Collaborator exceptions carry their own kind; bare I/O errors and timeouts
     * anywhere in the cause chain are transient; everything else is fatal.
     */
    public FailureKind classify(Throwable failure) {
        if (failure instanceof GenerationException ge) {
            return ge.getKind();
        }
        if (failure instanceof StorageException) {
            return FailureKind.TRANSIENT;
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof UncheckedIOException || t instanceof TimeoutException) {
                return FailureKind.TRANSIENT;
            }
        }
        return FailureKind.FATAL;
    }

    /**
     * Delay before re-running a job that has made {@code attempts} attempts so far:
     * base × factor^(attempts-1), capped at the max delay, plus up to jitterRatio of that.
     */
    public Duration delayFor(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        double raw = baseDelay.toMillis() * Math.pow(backoffFactor, exponent);
        long capped = (long) Math.min(raw, maxDelay.toMillis());
        long jitter = jitterRatio == 0 ? 0 : (long) (capped * jitterRatio * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(capped + jitter);
    }

    /** True once a job has used up its retry budget and must be failed. */
    public boolean isExhausted(int attempts) {
        return attempts > maxRetries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
