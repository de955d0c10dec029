package com.mediagen.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of one generation request: the prompt plus optional tuning knobs.
 *
 * Parsed from the job's stored parameters JSON. Absent knobs fall back to the
 * defaults below when the payload is built.
 */
public record GenerationInput(
        String  prompt,
        Integer width,
        Integer height,
        Integer steps,
        Double  guidanceScale,
        Long    seed
) {
    public static final int    DEFAULT_SIZE     = 1024;
    public static final int    DEFAULT_STEPS    = 4;
    public static final double DEFAULT_GUIDANCE = 3.5;

    public GenerationInput {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        checkRange("width",  width,  64, 2048);
        checkRange("height", height, 64, 2048);
        checkRange("num_inference_steps", steps, 1, 100);
        if (guidanceScale != null && (guidanceScale < 0 || guidanceScale > 50)) {
            throw new IllegalArgumentException("guidance_scale must be within [0, 50], got " + guidanceScale);
        }
    }

    /**
     * Build the input for {@code prompt} from a JSON object of parameters.
     *
     * @param parametersJson may be null or blank (all defaults)
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static GenerationInput parse(String prompt, String parametersJson, ObjectMapper json) {
        if (parametersJson == null || parametersJson.isBlank()) {
            return new GenerationInput(prompt, null, null, null, null, null);
        }
        try {
            // The prompt column is authoritative; a "prompt" key in the parameters is ignored.
            Knobs knobs = json.readValue(parametersJson, Knobs.class);
            if (knobs == null) {
                return new GenerationInput(prompt, null, null, null, null, null);
            }
            return new GenerationInput(prompt, knobs.width(), knobs.height(),
                    knobs.steps(), knobs.guidanceScale(), knobs.seed());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed generation parameters: " + e.getOriginalMessage(), e);
        }
    }

    /** Request payload with defaults applied; seed is omitted when unset. */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt",              prompt);
        payload.put("width",               width  != null ? width  : DEFAULT_SIZE);
        payload.put("height",              height != null ? height : DEFAULT_SIZE);
        payload.put("num_outputs",         1);
        payload.put("num_inference_steps", steps  != null ? steps  : DEFAULT_STEPS);
        payload.put("guidance_scale",      guidanceScale != null ? guidanceScale : DEFAULT_GUIDANCE);
        if (seed != null) {
            payload.put("seed", seed);
        }
        return payload;
    }

    private static void checkRange(String name, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(
                    "%s must be within [%d, %d], got %d".formatted(name, min, max, value));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Knobs(
            Integer width,
            Integer height,
            @JsonProperty("num_inference_steps") Integer steps,
            @JsonProperty("guidance_scale")      Double  guidanceScale,
            Long    seed
    ) {}
}
