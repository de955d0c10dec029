package com.mediagen.orchestrator.config;

import com.mediagen.orchestrator.storage.ArtifactStore;
import com.mediagen.orchestrator.storage.StoredArtifact;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.net.URI;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * A stored artifact is reachable through the URL recorded for it.
 */
@SpringBootTest
@AutoConfigureMockMvc
class MediaResourceConfigTest {

    @Autowired MockMvc       mockMvc;
    @Autowired ArtifactStore artifactStore;

    @Test
    void storedArtifact_isServedUnderItsPublicUrl() throws Exception {
        byte[] data = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};
        StoredArtifact stored = artifactStore.put(UUID.randomUUID(), data, "png");

        mockMvc.perform(get(URI.create(stored.url()).getPath()))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(data));
    }

    @Test
    void unknownArtifact_returns404() throws Exception {
        mockMvc.perform(get("/media/{name}", UUID.randomUUID() + ".png"))
                .andExpect(status().isNotFound());
    }
}
