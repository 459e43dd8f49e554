package com.tubedigest.feed.model;

import java.time.Instant;

public record CycleRunMeta(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String trigger,
    int quota,
    int processedCount,
    int skippedCount,
    int deferredCount,
    String notes
) {}
