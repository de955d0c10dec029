package com.mediagen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Backoff between whole-job attempts: base × factor^(attempt-1), capped, plus jitter.
 */
@ConfigurationProperties(prefix = "mediagen.retry")
public class RetryProperties {

    private Duration baseDelay = Duration.ofSeconds(60);

    private double backoffFactor = 2.0;

    private Duration maxDelay = Duration.ofSeconds(300);

    /** Upper bound of the random extra delay, as a fraction of the capped delay. */
    private double jitterRatio = 0.25;

    /** Attempts beyond this count force the job to FAILED. */
    private int maxRetries = 3;

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = backoffFactor;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }
}
