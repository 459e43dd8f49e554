package com.tubedigest.feed.model;

public record StageResult<T>(StageStatus status, T value, String reasonCode, String message) {

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(StageStatus.SUCCESS, value, null, null);
    }

    public static <T> StageResult<T> unavailable(String reasonCode, String message) {
        return new StageResult<>(StageStatus.UNAVAILABLE, null, reasonCode, message);
    }

    public static <T> StageResult<T> transientFailure(String reasonCode, String message) {
        return new StageResult<>(StageStatus.TRANSIENT, null, reasonCode, message);
    }

    public static <T> StageResult<T> fatal(String reasonCode, String message) {
        return new StageResult<>(StageStatus.FATAL, null, reasonCode, message);
    }

    public boolean isSuccess() {
        return status == StageStatus.SUCCESS;
    }
}
