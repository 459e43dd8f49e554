package com.tubedigest.feed.util;

import com.tubedigest.feed.model.ErrorCategory;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String NO_TRANSCRIPT = "NO_TRANSCRIPT";
  public static final String TRANSCRIPT_FAILED = "TRANSCRIPT_FAILED";
  public static final String SUMMARIZATION_FAILED = "SUMMARIZATION_FAILED";
  public static final String INVALID_INPUT = "INVALID_INPUT";
  public static final String RETRY_BUDGET_EXHAUSTED = "RETRY_BUDGET_EXHAUSTED";
  public static final String DISCOVERY_FAILED = "DISCOVERY_FAILED";
  public static final String CANCELLED = "CANCELLED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String NETWORK_ERROR = "NETWORK_ERROR";
  public static final String HTTP_400 = "HTTP_400";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 400) {
      return HTTP_400;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return NETWORK_ERROR;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, NETWORK_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }

  public static ErrorCategory categoryOf(String reasonCode) {
    if (reasonCode == null) {
      return ErrorCategory.TRANSIENT_NETWORK;
    }
    return switch (reasonCode) {
      case HTTP_429_RATE_LIMIT, RETRY_BUDGET_EXHAUSTED -> ErrorCategory.RATE_LIMITED;
      case NO_TRANSCRIPT, TRANSCRIPT_FAILED, SUMMARIZATION_FAILED, INVALID_INPUT, HTTP_404, HTTP_400,
          HTTP_401_403, PARSING_FAILED -> ErrorCategory.CONTENT_UNAVAILABLE;
      default -> ErrorCategory.TRANSIENT_NETWORK;
    };
  }
}
