package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.model.FailureKind;

/**
 * Result of one call to a collaborator (generation service or artifact store).
 *
 * The orchestrator turns every such call into a value of this type at a single
 * boundary and decides retry vs. fail from the value, not from catch blocks.
 */
public sealed interface CallOutcome<T> permits CallOutcome.Success, CallOutcome.Failure {

    record Success<T>(T value) implements CallOutcome<T> {}

    record Failure<T>(FailureKind kind, FailureStage stage, String detail, Throwable cause)
            implements CallOutcome<T> {

        /** Human-readable message recorded on the job, e.g. "Download failed: HTTP 503". */
        public String message() {
            return stage.describe(detail);
        }

        public boolean isTransient() {
            return kind == FailureKind.TRANSIENT;
        }
    }
}
