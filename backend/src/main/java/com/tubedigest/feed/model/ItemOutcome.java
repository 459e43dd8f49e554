package com.tubedigest.feed.model;

public enum ItemOutcome {
    SUMMARIZED,
    SKIPPED,
    DEFERRED;

    public boolean isTerminal() {
        return this != DEFERRED;
    }
}
