package com.tubedigest.feed.service;

public class CyclePersistenceException extends RuntimeException {
    private final long runId;

    public CyclePersistenceException(long runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
