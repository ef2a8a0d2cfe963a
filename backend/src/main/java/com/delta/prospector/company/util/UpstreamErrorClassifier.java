package com.delta.prospector.company.util;

import com.delta.prospector.company.model.HttpFetchResult;
import java.util.Locale;

public final class UpstreamErrorClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String NETWORK = "NETWORK";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String MALFORMED_RESPONSE = "MALFORMED_RESPONSE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private UpstreamErrorClassifier() {}

  public static String classify(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return UNAUTHORIZED;
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
    if (status >= 400) {
      return HTTP_4XX;
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
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      return NETWORK;
    }
    return UNKNOWN;
  }

  /** Failures that a later retry or resume can plausibly get past. */
  public static boolean isRetryable(String reasonCode) {
    return TIMEOUT.equals(reasonCode)
        || NETWORK.equals(reasonCode)
        || DNS_FAILURE.equals(reasonCode)
        || HTTP_429_RATE_LIMIT.equals(reasonCode)
        || HTTP_5XX.equals(reasonCode);
  }
}
