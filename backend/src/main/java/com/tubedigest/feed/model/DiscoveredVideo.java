package com.tubedigest.feed.model;

import java.time.Instant;

public record DiscoveredVideo(String videoId, String title, Instant publishedAt, String link) {}
