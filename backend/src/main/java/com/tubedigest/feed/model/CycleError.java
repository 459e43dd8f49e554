package com.tubedigest.feed.model;

public record CycleError(Long sourceId, String videoId, ErrorCategory category, String reasonCode, String message) {}
