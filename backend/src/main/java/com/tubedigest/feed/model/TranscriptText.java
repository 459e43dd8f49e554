package com.tubedigest.feed.model;

public record TranscriptText(String videoId, String language, String cleanText) {}
