package com.mediagen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Knobs of a single orchestration attempt and of the worker pool running attempts.
 */
@ConfigurationProperties(prefix = "mediagen.orchestration")
public class OrchestrationProperties {

    /** Fixed delay between two polls of the same prediction. */
    private Duration pollInterval = Duration.ofSeconds(10);

    /** Polls per attempt before the job is failed with a timeout. */
    private int maxPollAttempts = 30;

    /** Timeout of a single call to the generation service. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Single-flight lease TTL; must outlast {@link #longestAttempt()}. */
    private Duration leaseTtl = Duration.ofMinutes(30);

    /** Worker threads running attempts concurrently (different jobs only). */
    private int workers = 4;

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = maxPollAttempts;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getLeaseTtl() {
        return leaseTtl;
    }

    public void setLeaseTtl(Duration leaseTtl) {
        this.leaseTtl = leaseTtl;
    }

    /**
     * Upper bound on one attempt: a submit, every poll timing out, the sleeps
     * between polls and a download (which gets twice the request timeout).
     */
    public Duration longestAttempt() {
        return requestTimeout
                .plus(requestTimeout.multipliedBy(maxPollAttempts))
                .plus(pollInterval.multipliedBy(Math.max(0, maxPollAttempts - 1)))
                .plus(requestTimeout.multipliedBy(2));
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }
}
