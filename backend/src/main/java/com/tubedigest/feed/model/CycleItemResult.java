package com.tubedigest.feed.model;

import java.time.Instant;

public record CycleItemResult(
    String videoId,
    long sourceId,
    String title,
    Instant publishedAt,
    ItemOutcome outcome,
    String reasonCode,
    String message
) {}
