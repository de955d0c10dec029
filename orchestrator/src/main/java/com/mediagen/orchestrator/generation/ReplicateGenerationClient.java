package com.mediagen.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for a Replicate-style predictions API.
 *
 *   POST {base}/predictions       : start a prediction, 201 with {id, status}
 *   GET  {base}/predictions/{id}  : status, output URLs, error
 *   GET  {output url}             : artifact bytes
 *
 * HTTP 429 and 5xx are reported as TRANSIENT, other non-2xx codes as FATAL.
 * I/O errors and timeouts are TRANSIENT.
 */
public class ReplicateGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ReplicateGenerationClient.class);

    /** Model used when the job names none or the generic "stable-diffusion" alias. */
    static final String DEFAULT_MODEL_VERSION =
            "bf2f3f8fcd2c8bafa49d6f72e342c33c5463d78947f7a0eb8a6eb5da05c4e0c2";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Prediction(String id, String status, List<String> output, String error) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiToken;
    private final Duration     requestTimeout;
    private final Duration     downloadTimeout;

    public ReplicateGenerationClient(String baseUrl,
                                     String apiToken,
                                     Duration requestTimeout,
                                     ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                baseUrl, apiToken, requestTimeout, objectMapper);
    }

    ReplicateGenerationClient(HttpClient http,
                              String baseUrl,
                              String apiToken,
                              Duration requestTimeout,
                              ObjectMapper objectMapper) {
        this.http            = http;
        this.baseUrl         = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken        = apiToken;
        this.json            = objectMapper;
        this.requestTimeout  = requestTimeout;
        this.downloadTimeout = requestTimeout.multipliedBy(2);
    }

    // ------------------------------------------------------------------
    // GenerationClient
    // ------------------------------------------------------------------

    @Override
    public String submit(String model, GenerationInput input) {
        String body = toJson(Map.of("version", resolveVersion(model),
                                    "input",   input.toPayload()));
        HttpRequest req = authorized(URI.create(baseUrl + "/predictions"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        Prediction prediction = parse(send(req, "submit"), "submit");
        if (prediction.id() == null || prediction.id().isBlank()) {
            throw GenerationException.fatal("submit response carried no prediction id");
        }
        log.info("Submitted prediction {} for model '{}'", prediction.id(), model);
        return prediction.id();
    }

    @Override
    public PollResult poll(String handle) {
        HttpRequest req = authorized(URI.create(baseUrl + "/predictions/" + handle))
                .timeout(requestTimeout)
                .GET()
                .build();
        Prediction prediction = parse(send(req, "poll " + handle), "poll " + handle);
        return toPollResult(prediction);
    }

    @Override
    public byte[] fetch(String url) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(downloadTimeout)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            checkStatus(resp.statusCode(), "download of " + url, "");
            return resp.body();
        } catch (IOException e) {
            throw GenerationException.transientFailure("download of " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GenerationException.transientFailure("download of " + url + " interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String resolveVersion(String model) {
        if (model == null || model.isBlank() || "stable-diffusion".equals(model)) {
            return DEFAULT_MODEL_VERSION;
        }
        int colon = model.lastIndexOf(':');
        return colon >= 0 ? model.substring(colon + 1) : model;
    }

    static PollResult toPollResult(Prediction prediction) {
        String status = prediction.status() == null ? "" : prediction.status();
        return switch (status) {
            case "succeeded"             -> PollResult.succeeded(prediction.output());
            case "failed", "canceled"    -> PollResult.failed(
                    prediction.error() != null ? prediction.error() : "prediction " + status);
            case "starting", "processing" -> PollResult.processing();
            default -> throw GenerationException.fatal(
                    "unexpected prediction status '" + status + "' for " + prediction.id());
        };
    }

    /** Map an HTTP status code to success or a classified failure. */
    static void checkStatus(int code, String opName, String body) {
        if (code >= 200 && code < 300) {
            return;
        }
        FailureKind kind = (code == 429 || code >= 500) ? FailureKind.TRANSIENT : FailureKind.FATAL;
        throw new GenerationException(kind, opName + " failed: HTTP " + code + ": " + body);
    }

    private HttpRequest.Builder authorized(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Authorization", "Token " + apiToken)
                .header("Accept", "application/json");
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            checkStatus(resp.statusCode(), opName, resp.body());
            return resp.body();
        } catch (IOException e) {
            throw GenerationException.transientFailure(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GenerationException.transientFailure(opName + " interrupted", e);
        }
    }

    private Prediction parse(String body, String opName) {
        try {
            return json.readValue(body, Prediction.class);
        } catch (JsonProcessingException e) {
            throw new GenerationException(FailureKind.FATAL, "Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GenerationException(FailureKind.FATAL, "JSON serialization failed", e);
        }
    }
}
