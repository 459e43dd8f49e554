package com.tubedigest.feed.model;

import java.time.Instant;

public record DigestItem(String videoId, String title, String summary, String link, Instant publishedAt) {}
