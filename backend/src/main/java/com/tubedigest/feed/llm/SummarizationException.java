package com.tubedigest.feed.llm;

import com.tubedigest.feed.util.ReasonCodeClassifier;

public class SummarizationException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        INVALID_INPUT,
        UNAVAILABLE
    }

    private final Kind kind;
    private final String reasonCode;
    private final boolean retryable;

    public SummarizationException(Kind kind, String reasonCode, boolean retryable, String message) {
        super(message);
        this.kind = kind;
        this.reasonCode = reasonCode;
        this.retryable = retryable;
    }

    public static SummarizationException rateLimited(String message) {
        return new SummarizationException(Kind.RATE_LIMITED, ReasonCodeClassifier.HTTP_429_RATE_LIMIT, true, message);
    }

    public static SummarizationException invalidInput(String message) {
        return new SummarizationException(Kind.INVALID_INPUT, ReasonCodeClassifier.INVALID_INPUT, false, message);
    }

    public static SummarizationException unavailable(String reasonCode, boolean retryable, String message) {
        return new SummarizationException(Kind.UNAVAILABLE, reasonCode, retryable, message);
    }

    public Kind getKind() {
        return kind;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
