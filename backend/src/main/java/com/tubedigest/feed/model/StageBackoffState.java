package com.tubedigest.feed.model;

public record StageBackoffState(
    StageKind stage,
    int consecutiveThrottles,
    long nextBackoffMs
) {
}
