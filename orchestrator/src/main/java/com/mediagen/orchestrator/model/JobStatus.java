package com.mediagen.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a generation Job.
 *
 * Transitions:
 *   PENDING    → PROCESSING  (first orchestration attempt)
 *   PROCESSING → PROCESSING  (resumed attempt confirms the state)
 *   PROCESSING → COMPLETED | FAILED
 *   PENDING | PROCESSING → CANCELLED
 *
 * COMPLETED, FAILED and CANCELLED are terminal: no outgoing edges.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** States a job may be in while an orchestration attempt still has work to do. */
    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING    -> target == PROCESSING || target == CANCELLED;
            case PROCESSING -> target == PROCESSING || target == COMPLETED
                            || target == FAILED     || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
