package com.tubedigest.feed.model;

import java.time.Instant;

/**
 * Ledger row for a video that reached a terminal outcome. Exactly one of
 * {@code summary} and {@code skipReason} is set.
 */
public record ProcessedRecord(
    String videoId,
    long sourceId,
    Long runId,
    String title,
    String summary,
    String skipReason,
    String link,
    Instant publishedAt,
    Instant processedAt
) {
    public static ProcessedRecord summarized(VideoCandidate candidate, Long runId, String summary, Instant processedAt) {
        return new ProcessedRecord(
            candidate.videoId(),
            candidate.sourceId(),
            runId,
            candidate.title(),
            summary,
            null,
            candidate.link(),
            candidate.publishedAt(),
            processedAt
        );
    }

    public static ProcessedRecord skipped(VideoCandidate candidate, Long runId, String skipReason, Instant processedAt) {
        return new ProcessedRecord(
            candidate.videoId(),
            candidate.sourceId(),
            runId,
            candidate.title(),
            null,
            skipReason,
            candidate.link(),
            candidate.publishedAt(),
            processedAt
        );
    }

    public boolean isSummarized() {
        return summary != null && skipReason == null;
    }
}
