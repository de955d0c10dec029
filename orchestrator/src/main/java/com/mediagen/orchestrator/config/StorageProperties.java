package com.mediagen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "mediagen.storage")
public class StorageProperties {

    /** Directory holding generated artifacts. */
    private Path basePath = Path.of("./storage/media");

    /** Directory holding per-job metadata JSON. */
    private Path metadataPath = Path.of("./storage/metadata");

    /** Public URL prefix under which artifacts are served. */
    private String baseUrl = "http://localhost:8080/media";

    /** Request path this service serves {@link #basePath} under; the path of {@link #baseUrl}. */
    private String publicPath = "/media";

    public Path getBasePath() {
        return basePath;
    }

    public void setBasePath(Path basePath) {
        this.basePath = basePath;
    }

    public Path getMetadataPath() {
        return metadataPath;
    }

    public void setMetadataPath(Path metadataPath) {
        this.metadataPath = metadataPath;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPublicPath() {
        return publicPath;
    }

    public void setPublicPath(String publicPath) {
        this.publicPath = publicPath;
    }
}
