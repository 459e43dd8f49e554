package com.tubedigest.feed.model;

public enum StageStatus {
    SUCCESS,
    UNAVAILABLE,
    TRANSIENT,
    FATAL
}
