package com.mediagen.orchestrator.generation;

/**
 * Asynchronous, unreliable image generation service.
 *
 * One implementation is chosen when the application context is built
 * (see GenerationClientConfig); callers never branch on which one it is.
 * All calls block and may be slow; they are made from orchestrator worker threads.
 */
public interface GenerationClient {

    /**
     * Start a prediction.
     *
     * @return the external handle identifying the prediction
     * @throws GenerationException TRANSIENT for network trouble, FATAL if the request is rejected
     */
    String submit(String model, GenerationInput input);

    /**
     * Current status of a prediction.
     *
     * @throws GenerationException on transport or service errors
     */
    PollResult poll(String handle);

    /**
     * Download a produced artifact.
     *
     * @throws GenerationException on transport or service errors
     */
    byte[] fetch(String url);
}
