package com.mediagen.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobLease}.
 *
 * Enough for a single orchestrator instance. Several instances sharing one
 * database need a lease with the same contract backed by shared storage.
 */
@Component
public class InMemoryJobLease implements JobLease {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobLease.class);

    private record Grant(UUID token, Instant expiresAt) {}

    private final Map<UUID, Grant> grants = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobLease(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Held> tryAcquire(UUID jobId, Duration ttl) {
        Instant now = clock.instant();
        Grant mine = new Grant(UUID.randomUUID(), now.plus(ttl));
        Grant current = grants.compute(jobId, (id, existing) -> {
            if (existing == null) {
                return mine;
            }
            if (!existing.expiresAt().isAfter(now)) {
                log.warn("Lease for job {} expired at {}, taking it over", id, existing.expiresAt());
                return mine;
            }
            return existing;
        });
        if (current != mine) {
            return Optional.empty();
        }
        return Optional.of(new HeldGrant(jobId, mine));
    }

    private final class HeldGrant implements Held {
        private final UUID  jobId;
        private final Grant grant;

        private HeldGrant(UUID jobId, Grant grant) {
            this.jobId = jobId;
            this.grant = grant;
        }

        @Override
        public UUID jobId() {
            return jobId;
        }

        @Override
        public void close() {
            // Only remove our own grant; after expiry someone else may hold it.
            grants.remove(jobId, grant);
        }
    }
}
