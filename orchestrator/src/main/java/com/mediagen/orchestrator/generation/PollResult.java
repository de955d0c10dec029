package com.mediagen.orchestrator.generation;

import java.util.List;

/**
 * Snapshot of an external prediction as returned by {@link GenerationClient#poll}.
 *
 * output is empty (never null) unless the prediction succeeded with results.
 */
public record PollResult(Status status, List<String> output, String error) {

    public enum Status { PROCESSING, SUCCEEDED, FAILED }

    public PollResult {
        output = output == null ? List.of() : List.copyOf(output);
    }

    public static PollResult processing() {
        return new PollResult(Status.PROCESSING, List.of(), null);
    }

    public static PollResult succeeded(List<String> output) {
        return new PollResult(Status.SUCCEEDED, output, null);
    }

    public static PollResult failed(String error) {
        return new PollResult(Status.FAILED, List.of(), error);
    }

    /** First output URL, or null when the service produced nothing. */
    public String firstOutput() {
        return output.isEmpty() ? null : output.get(0);
    }
}
