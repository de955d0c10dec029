package com.mediagen.orchestrator.api;

import com.mediagen.orchestrator.api.dto.GenerateJobRequest;
import com.mediagen.orchestrator.api.dto.JobListResponse;
import com.mediagen.orchestrator.api.dto.JobResponse;
import com.mediagen.orchestrator.model.InvalidTransitionException;
import com.mediagen.orchestrator.model.Job;
import com.mediagen.orchestrator.model.JobStatus;
import com.mediagen.orchestrator.repository.JobNotFoundException;
import com.mediagen.orchestrator.service.JobService;
import com.mediagen.orchestrator.storage.ArtifactContent;
import com.mediagen.orchestrator.storage.ArtifactNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for image generation jobs.
 *
 * POST   /api/v1/generate             submit a prompt, returns the PENDING job
 * GET    /api/v1/status/{id}          current state of a job
 * GET    /api/v1/jobs                 list jobs, optional ?status=&limit=&offset=
 * GET    /api/v1/download/{id}        artifact bytes of a COMPLETED job
 * GET    /api/v1/jobs/{id}/metadata   generation metadata recorded at submission
 * DELETE /api/v1/jobs/{id}            cancel a PENDING or PROCESSING job
 */
@RestController
@RequestMapping("/api/v1")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"prompt":"a lighthouse at dusk","parameters":{"width":768,"height":768}}'
     */
    @PostMapping("/generate")
    public ResponseEntity<JobResponse> generate(@RequestBody GenerateJobRequest req) {
        try {
            Job job = jobService.create(req.prompt(), req.model(), req.parameters());
            return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/status/{id}")
    public JobResponse status(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/jobs")
    public JobListResponse list(@RequestParam(required = false) JobStatus status,
                                @RequestParam(defaultValue = "10") int limit,
                                @RequestParam(defaultValue = "0") int offset) {
        try {
            return new JobListResponse(
                    jobService.list(status, limit, offset).stream().map(JobResponse::from).toList(),
                    limit, offset);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * HTTP 200: artifact bytes
     * HTTP 404: unknown job, or the artifact was reclaimed
     * HTTP 409: job is not COMPLETED
     */
    @GetMapping("/download/{id}")
    public ResponseEntity<byte[]> download(@PathVariable UUID id) {
        try {
            ArtifactContent artifact = jobService.readArtifact(id);
            String fileName = artifact.fileName(id);
            return ResponseEntity.ok()
                    .contentType(MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM))
                    .header("Content-Disposition", "attachment; filename=\"" + fileName + "\"")
                    .body(artifact.data());
        } catch (JobNotFoundException e) {
            throw notFound(id);
        } catch (ArtifactNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/jobs/{id}/metadata")
    public Map<String, Object> metadata(@PathVariable UUID id) {
        try {
            return jobService.readMetadata(id);
        } catch (JobNotFoundException e) {
            throw notFound(id);
        } catch (ArtifactNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /** Returns 409 if the job is already COMPLETED, FAILED or CANCELLED. */
    @DeleteMapping("/jobs/{id}")
    public JobResponse cancel(@PathVariable UUID id) {
        try {
            return JobResponse.from(jobService.cancel(id));
        } catch (JobNotFoundException e) {
            throw notFound(id);
        } catch (InvalidTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Job " + id + " cannot be cancelled, it is " + e.getFrom());
        }
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }
}
