package com.mediagen.orchestrator.service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-flight lease per job id.
 *
 * At most one orchestration attempt may hold the lease for a given job. Without it
 * two workers could both see an empty external handle and submit the job twice.
 * The TTL bounds how long a crashed holder can block the job.
 */
public interface JobLease {

    /** @return the held lease, or empty if another holder has it and it has not expired */
    Optional<Held> tryAcquire(UUID jobId, Duration ttl);

    /** A granted lease. Closing it releases the lease if it is still ours. */
    interface Held extends AutoCloseable {

        UUID jobId();

        @Override
        void close();
    }
}
