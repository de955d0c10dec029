package com.mediagen.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.generation.GenerationClient;
import com.mediagen.orchestrator.generation.ReplicateGenerationClient;
import com.mediagen.orchestrator.generation.SimulatedGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wiring of the process-wide collaborators.
 *
 * The generation client is picked once here from {@code mediagen.generation.client};
 * nothing downstream knows which implementation it got.
 */
@Configuration
public class GenerationClientConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationClientConfig.class);

    @Bean
    GenerationClient generationClient(GenerationProperties generation,
                                      OrchestrationProperties orchestration,
                                      ObjectMapper objectMapper) {
        return switch (generation.getClient()) {
            case REPLICATE -> {
                if (generation.getApiToken() == null || generation.getApiToken().isBlank()) {
                    throw new IllegalStateException(
                            "mediagen.generation.api-token is required when client=replicate");
                }
                log.info("Using Replicate generation client at {}", generation.getBaseUrl());
                yield new ReplicateGenerationClient(generation.getBaseUrl(), generation.getApiToken(),
                        orchestration.getRequestTimeout(), objectMapper);
            }
            case SIMULATED -> {
                GenerationProperties.Simulated sim = generation.getSimulated();
                log.info("Using simulated generation client (failure rate {})", sim.getFailureRate());
                yield new SimulatedGenerationClient(sim.getMinLatency(), sim.getMaxLatency(),
                        sim.getFailureRate(), new SecureRandom());
            }
        };
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
