package com.tubedigest.feed.youtube;

public class ChannelResolutionException extends RuntimeException {
    private final String reasonCode;

    public ChannelResolutionException(String message, String reasonCode) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
