package com.tubedigest.feed.youtube;

public class DiscoveryException extends RuntimeException {
    private final boolean transientFailure;
    private final String reasonCode;

    public DiscoveryException(String message, String reasonCode, boolean transientFailure) {
        super(message);
        this.reasonCode = reasonCode;
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
