package com.mediagen.orchestrator.generation;

import com.mediagen.orchestrator.model.FailureKind;

/**
 * Thrown by a {@link GenerationClient} when the generation service rejects a call
 * or cannot be reached. The kind tells the orchestrator whether to retry later.
 */
public class GenerationException extends RuntimeException {

    private final FailureKind kind;

    public GenerationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GenerationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GenerationException transientFailure(String message, Throwable cause) {
        return new GenerationException(FailureKind.TRANSIENT, message, cause);
    }

    public static GenerationException fatal(String message) {
        return new GenerationException(FailureKind.FATAL, message);
    }

    public FailureKind getKind() { return kind; }
}
