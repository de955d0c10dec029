package com.mediagen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "mediagen.retention")
public class RetentionProperties {

    /** Completed jobs older than this lose their stored artifact. */
    private Duration maxAge = Duration.ofDays(7);

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }
}
