package com.tubedigest.feed.model;

import java.time.Instant;

public record VideoCandidate(
    String videoId,
    String title,
    Instant publishedAt,
    String link,
    long sourceId
) {
    public static VideoCandidate from(DiscoveredVideo video, long sourceId) {
        return new VideoCandidate(video.videoId(), video.title(), video.publishedAt(), video.link(), sourceId);
    }
}
