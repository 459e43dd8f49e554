package com.tubedigest.feed.service;

/**
 * Raised when a ledger insert loses to an earlier insert of the same video id.
 */
public class DuplicateVideoException extends RuntimeException {
    private final String videoId;

    public DuplicateVideoException(String videoId, Throwable cause) {
        super("Video " + videoId + " is already in the ledger", cause);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
