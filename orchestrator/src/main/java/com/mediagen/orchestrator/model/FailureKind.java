package com.mediagen.orchestrator.model;

/**
 * Whether a failure is worth another attempt of the whole job.
 *
 * TRANSIENT: network errors, timeouts, anything a collaborator marks as temporary.
 * FATAL:     malformed input, explicit external failure, protocol violation, poll timeout.
 */
public enum FailureKind {
    TRANSIENT,
    FATAL
}
