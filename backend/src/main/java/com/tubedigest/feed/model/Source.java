package com.tubedigest.feed.model;

import java.time.Instant;

public record Source(
    long sourceId,
    String channelRef,
    String name,
    String url,
    boolean active,
    Instant watermark,
    Instant createdAt
) {
}
