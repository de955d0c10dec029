package com.mediagen.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/v1/generate.
 *
 * Required: prompt
 * Optional: model (defaults to mediagen.generation.default-model), parameters
 *   (width, height, num_inference_steps, guidance_scale, seed).
 */
public record GenerateJobRequest(String prompt, String model, Map<String, Object> parameters) {}
