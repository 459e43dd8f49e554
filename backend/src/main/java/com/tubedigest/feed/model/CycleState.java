package com.tubedigest.feed.model;

public enum CycleState {
    IDLE,
    DISCOVERING,
    SELECTING,
    PROCESSING,
    FINALIZING
}
