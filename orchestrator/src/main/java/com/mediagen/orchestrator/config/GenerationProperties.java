package com.mediagen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Which generation service to talk to and how.
 */
@ConfigurationProperties(prefix = "mediagen.generation")
public class GenerationProperties {

    public enum ClientType {
        /** In-process stand-in with random latency and failures. */
        SIMULATED,
        /** Replicate-style HTTP predictions API. */
        REPLICATE
    }

    private ClientType client = ClientType.SIMULATED;

    private String baseUrl = "https://api.replicate.com/v1";

    private String apiToken = "";

    /** Model used when a request names none. */
    private String defaultModel = "stable-diffusion";

    private final Simulated simulated = new Simulated();

    public ClientType getClient() {
        return client;
    }

    public void setClient(ClientType client) {
        this.client = client;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public Simulated getSimulated() {
        return simulated;
    }

    public static class Simulated {

        private Duration minLatency = Duration.ofSeconds(2);

        private Duration maxLatency = Duration.ofSeconds(10);

        /** Fraction of submits failing transiently; polls fail at half this rate. */
        private double failureRate = 0.1;

        public Duration getMinLatency() {
            return minLatency;
        }

        public void setMinLatency(Duration minLatency) {
            this.minLatency = minLatency;
        }

        public Duration getMaxLatency() {
            return maxLatency;
        }

        public void setMaxLatency(Duration maxLatency) {
            this.maxLatency = maxLatency;
        }

        public double getFailureRate() {
            return failureRate;
        }

        public void setFailureRate(double failureRate) {
            this.failureRate = failureRate;
        }
    }
}
