package com.tenderwatch.monitor.util;

import com.tenderwatch.monitor.model.FailureKind;

import java.io.IOException;
import java.util.Locale;

public final class FailureClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String AUTH_FAILED = "AUTH_FAILED";
  public static final String INVALID_DESTINATION = "INVALID_DESTINATION";
  public static final String REJECTED = "REJECTED";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private FailureClassifier() {}

  public static String fromHttpStatus(int status) {
    if (status == 401 || status == 403) {
      return AUTH_FAILED;
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
    if (status == 400 || status == 404 || status == 422) {
      return INVALID_DESTINATION;
    }
    if (status >= 400 && status < 500) {
      return REJECTED;
    }
    return UNKNOWN;
  }

  public static String fromThrowable(Throwable error) {
    if (error == null) {
      return UNKNOWN;
    }
    String type = error.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    if (type.contains("timeout") || message.contains("timed out")) {
      return TIMEOUT;
    }
    if (error instanceof InterruptedException) {
      return INTERRUPTED;
    }
    if (type.contains("unknownhost")
        || message.contains("name or service not known")
        || message.contains("no such host")) {
      return DNS_FAILURE;
    }
    if (type.contains("ssl") || message.contains("handshake")) {
      return TLS_FAILURE;
    }
    if (error instanceof IOException) {
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, IO_ERROR, DNS_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX, UNKNOWN -> true;
      default -> false;
    };
  }

  public static FailureKind kindOf(String reasonCode) {
    return isRetryable(reasonCode) ? FailureKind.RETRYABLE : FailureKind.TERMINAL;
  }
}
