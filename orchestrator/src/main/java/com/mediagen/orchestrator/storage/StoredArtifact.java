package com.mediagen.orchestrator.storage;

/** Where an artifact was written: store-local path and public URL. */
public record StoredArtifact(String path, String url) {}
