package com.taggernews.ingest.util;

import java.util.Locale;

public final class FetchErrorClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String MISSING = "MISSING";
  public static final String DELETED = "DELETED";
  public static final String DEAD = "DEAD";
  public static final String UNPARSEABLE = "UNPARSEABLE";
  public static final String STORE_FAILED = "STORE_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private FetchErrorClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
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
    if (status >= 400 && status < 500) {
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
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
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
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  /** Statuses worth another attempt: request timeout, rate limiting and server errors. */
  public static boolean isTransientStatus(int status) {
    return status == 408 || status == 429 || status >= 500;
  }
}
