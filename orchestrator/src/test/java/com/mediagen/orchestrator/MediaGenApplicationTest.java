package com.mediagen.orchestrator;

import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context on H2 with the simulated generation client: a created job is
 * picked up by the dispatcher and driven to a terminal state.
 */
@SpringBootTest(properties = {
        "mediagen.generation.simulated.min-latency=0ms",
        "mediagen.generation.simulated.max-latency=0ms",
        "mediagen.generation.simulated.failure-rate=0",
        "mediagen.orchestration.max-poll-attempts=50"
})
class MediaGenApplicationTest {

    @Autowired JobService jobService;

    @Test
    void createdJob_reachesTerminalState() throws Exception {
        Job created = jobService.create("a lighthouse at dusk", null, Map.of("width", 256, "height", 256));

        Job job = awaitTerminal(created, Duration.ofSeconds(20));

        assertThat(job.getStatus()).isIn(JobStatus.COMPLETED, JobStatus.FAILED);
        assertThat(job.getExternalHandle()).isNotBlank();
        assertThat(job.getRetryCount()).isEqualTo(1);
        assertThat(jobService.readMetadata(job.getId())).containsEntry("external_job_id", job.getExternalHandle());
        if (job.getStatus() == JobStatus.COMPLETED) {
            assertThat(jobService.readArtifact(job.getId()).data()).hasSize(job.getResult().getSizeBytes().intValue());
        } else {
            assertThat(job.getErrorMessage()).startsWith("Generation failed");
        }
    }

    private Job awaitTerminal(Job job, Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().isBefore(deadline)) {
            Job current = jobService.findById(job.getId()).orElseThrow();
            if (current.getStatus().isTerminal()) {
                return current;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Job " + job.getId() + " did not finish within " + timeout);
    }
}
