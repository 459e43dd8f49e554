package com.tubedigest.feed.model;

public enum StageKind {
    DISCOVERY,
    TRANSCRIPT,
    SUMMARIZE
}
