package com.mediagen.orchestrator.service;

/** Outcome of one retention sweep: candidates found and artifacts reclaimed. */
public record SweepResult(int scanned, int reclaimed) {}
