package com.tubedigest.feed.model;

public record CycleRunRequest(Integer quota, String trigger) {

    public static CycleRunRequest defaults(String trigger) {
        return new CycleRunRequest(null, trigger);
    }

    public String normalizedTrigger() {
        if (trigger == null || trigger.isBlank()) {
            return "manual";
        }
        return trigger.trim();
    }
}
