package com.mediagen.orchestrator.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.UUID;

/**
 * Local filesystem artifact store.
 *
 * Layout:
 *   {base-path}/{jobId}.{ext}         : artifact bytes
 *   {metadata-path}/{jobId}.json      : generation metadata
 *
 * Every write goes to a temp file in the target directory and is then moved over
 * the final name, so readers never see a partial file and rewrites replace cleanly.
 */
@Component
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final Path         basePath;
    private final Path         metadataPath;
    private final String       baseUrl;
    private final ObjectMapper json;

    public LocalArtifactStore(StorageProperties properties, ObjectMapper objectMapper) {
        this.basePath     = properties.getBasePath();
        this.metadataPath = properties.getMetadataPath();
        this.baseUrl      = stripTrailingSlash(properties.getBaseUrl());
        this.json         = objectMapper;
        try {
            Files.createDirectories(basePath);
            Files.createDirectories(metadataPath);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories under " + basePath, e);
        }
    }

    @Override
    public StoredArtifact put(UUID jobId, byte[] data, String extension) {
        Path target = artifactPath(jobId, extension);
        try {
            writeAtomically(target, data);
        } catch (IOException e) {
            throw new StorageException("Failed to save file for job " + jobId, e);
        }
        log.info("Stored artifact for job {} at {} ({} bytes)", jobId, target, data.length);
        return new StoredArtifact(target.toString(), baseUrl + "/" + fileName(jobId, extension));
    }

    @Override
    public String putMetadata(UUID jobId, Map<String, Object> metadata) {
        Path target = metadataFile(jobId);
        try {
            writeAtomically(target, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
        } catch (IOException e) {
            throw new StorageException("Failed to save metadata for job " + jobId, e);
        }
        return target.toString();
    }

    @Override
    public byte[] get(UUID jobId, String extension) {
        try {
            return Files.readAllBytes(artifactPath(jobId, extension));
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(jobId, "File");
        } catch (IOException e) {
            throw new StorageException("Failed to read file for job " + jobId, e);
        }
    }

    @Override
    public Map<String, Object> getMetadata(UUID jobId) {
        try {
            return json.readValue(Files.readAllBytes(metadataFile(jobId)), METADATA_TYPE);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(jobId, "Metadata");
        } catch (IOException e) {
            throw new StorageException("Failed to read metadata for job " + jobId, e);
        }
    }

    @Override
    public boolean delete(UUID jobId, String extension) {
        return deleteIfExists(artifactPath(jobId, extension), jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean deleteIfExists(Path path, UUID jobId) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + path.getFileName() + " for job " + jobId, e);
        }
    }

    private void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path artifactPath(UUID jobId, String extension) {
        return basePath.resolve(fileName(jobId, extension));
    }

    private Path metadataFile(UUID jobId) {
        return metadataPath.resolve(jobId + ".json");
    }

    private static String fileName(UUID jobId, String extension) {
        return jobId + "." + extension;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
