package com.mediagen.orchestrator.service;

/**
 * Where in the lifecycle a failure happened. Prefixes the job's error_message
 * so users can tell submission problems from generation or storage problems.
 */
public enum FailureStage {
    SUBMISSION("Submission failed"),
    GENERATION("Generation failed"),
    DOWNLOAD("Download failed"),
    STORAGE("Storage failed"),
    TIMEOUT("Timed out"),
    INTERNAL("Internal error");

    private final String label;

    FailureStage(String label) {
        this.label = label;
    }

    public String describe(String detail) {
        return detail == null || detail.isBlank() ? label : label + ": " + detail;
    }
}
