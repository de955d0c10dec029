package com.mediagen.orchestrator.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediagen.orchestrator.config.StorageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalArtifactStoreTest {

    @TempDir Path root;

    LocalArtifactStore store;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setBasePath(root.resolve("media"));
        properties.setMetadataPath(root.resolve("metadata"));
        properties.setBaseUrl("http://cdn.test/media/");
        store = new LocalArtifactStore(properties, new ObjectMapper());
    }

    @Test
    void put_writesFileNamedAfterJobAndReturnsPublicUrl() throws Exception {
        UUID jobId = UUID.randomUUID();

        StoredArtifact artifact = store.put(jobId, new byte[]{1, 2, 3}, "png");

        assertThat(Path.of(artifact.path())).isEqualTo(root.resolve("media").resolve(jobId + ".png"));
        assertThat(artifact.url()).isEqualTo("http://cdn.test/media/" + jobId + ".png");
        assertThat(Files.readAllBytes(Path.of(artifact.path()))).containsExactly(1, 2, 3);
        assertThat(store.get(jobId, "png")).containsExactly(1, 2, 3);
    }

    @Test
    void put_sameKeyTwice_overwritesAndLeavesNoTempFiles() throws Exception {
        UUID jobId = UUID.randomUUID();

        store.put(jobId, new byte[]{1}, "png");
        store.put(jobId, new byte[]{2, 2}, "png");

        assertThat(store.get(jobId, "png")).containsExactly(2, 2);
        try (var files = Files.list(root.resolve("media"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void get_missing_throwsNotFound() {
        assertThatThrownBy(() -> store.get(UUID.randomUUID(), "png"))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    void delete_isIdempotent() {
        UUID jobId = UUID.randomUUID();
        store.put(jobId, new byte[]{1}, "jpg");

        assertThat(store.delete(jobId, "jpg")).isTrue();
        assertThat(store.delete(jobId, "jpg")).isFalse();
    }

    @Test
    void metadata_roundTripsAsJson() {
        UUID jobId = UUID.randomUUID();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("prompt", "a fox");
        metadata.put("external_job_id", "ext-1");
        metadata.put("parameters", Map.of("width", 1024));

        String path = store.putMetadata(jobId, metadata);

        assertThat(Path.of(path).getFileName().toString()).isEqualTo(jobId + ".json");
        assertThat(store.getMetadata(jobId)).containsEntry("external_job_id", "ext-1")
                                            .containsEntry("parameters", Map.of("width", 1024));
    }

    @Test
    void getMetadata_missing_throwsNotFound() {
        assertThatThrownBy(() -> store.getMetadata(UUID.randomUUID()))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    void extensionOf_handlesUrlsQueriesAndOddNames() {
        assertThat(ArtifactStore.extensionOf("https://cdn.test/out/a.webp?sig=1")).isEqualTo("webp");
        assertThat(ArtifactStore.extensionOf("/data/media/x.PNG")).isEqualTo("png");
        assertThat(ArtifactStore.extensionOf("https://cdn.test/out/noext")).isEqualTo("png");
        assertThat(ArtifactStore.extensionOf("https://cdn.test/v1.2/file")).isEqualTo("png");
        assertThat(ArtifactStore.extensionOf("a.not-an-ext")).isEqualTo("png");
        assertThat(ArtifactStore.extensionOf(null)).isEqualTo("png");
    }
}
