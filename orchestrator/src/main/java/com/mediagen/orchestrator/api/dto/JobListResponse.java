package com.mediagen.orchestrator.api.dto;

import java.util.List;

/** Response body for GET /api/v1/jobs: one page of jobs, newest first. */
public record JobListResponse(List<JobResponse> jobs, int limit, int offset) {}
