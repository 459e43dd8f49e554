package com.tubedigest.feed.model;

public enum ErrorCategory {
    TRANSIENT_NETWORK,
    RATE_LIMITED,
    CONTENT_UNAVAILABLE,
    PERSISTENCE_FAILURE,
    CONFIGURATION_ERROR
}
