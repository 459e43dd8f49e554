package com.tubedigest.feed.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CycleRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int quota,
    int quotaRemaining,
    int discoveredCount,
    int selectedCount,
    int processedCount,
    int skippedCount,
    int deferredCount,
    boolean cancelled,
    List<CycleItemResult> items,
    List<CycleError> errors,
    Map<Long, Instant> advancedWatermarks) {}
