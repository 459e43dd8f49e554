package com.tubedigest.feed.service;

public class SourceNotFoundException extends RuntimeException {
    private final long sourceId;

    public SourceNotFoundException(long sourceId) {
        super("Unknown source id " + sourceId);
        this.sourceId = sourceId;
    }

    public long getSourceId() {
        return sourceId;
    }
}
