package com.mediagen.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Location of a materialized artifact.
 *
 * Embedded into the jobs table; all three columns are null when the job has no result
 * (not completed yet, or reclaimed by the retention sweep).
 */
@Embeddable
public class JobResult {

    @Column(name = "result_path")
    private String path;

    @Column(name = "result_url")
    private String url;

    @Column(name = "result_size_bytes")
    private Long sizeBytes;

    protected JobResult() {}   // required by JPA

    public JobResult(String path, String url, long sizeBytes) {
        this.path      = path;
        this.url       = url;
        this.sizeBytes = sizeBytes;
    }

    public String getPath()      { return path; }
    public String getUrl()       { return url; }
    public Long   getSizeBytes() { return sizeBytes; }
}
