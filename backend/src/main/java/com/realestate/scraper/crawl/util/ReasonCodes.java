package com.realestate.scraper.crawl.util;

import com.realestate.scraper.crawl.model.FetchOutcome;

import java.util.Locale;

public final class ReasonCodes {
  public static final String ROBOTS_DISALLOWED = "ROBOTS_DISALLOWED";
  public static final String ROBOTS_UNAVAILABLE = "ROBOTS_UNAVAILABLE";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String HTTP_OTHER = "HTTP_OTHER";
  public static final String TOO_MANY_REDIRECTS = "TOO_MANY_REDIRECTS";
  public static final String PARSE_FIELD_MISSING = "PARSE_FIELD_MISSING";
  public static final String PARSE_FAILED = "PARSE_FAILED";
  public static final String SINK_FAILED = "SINK_FAILED";
  public static final String JOB_CONFIG_INVALID = "JOB_CONFIG_INVALID";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodes() {}

  public static String fromOutcome(FetchOutcome outcome) {
    if (outcome == null) {
      return UNKNOWN;
    }
    if (outcome.errorCode() != null) {
      return fromErrorCode(outcome.errorCode(), outcome.errorMessage());
    }
    return fromHttpStatus(outcome.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return HTTP_OTHER;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.equals(FetchOutcome.INVALID_URL)) {
      return INVALID_URL;
    }
    if (code.equals(FetchOutcome.INTERRUPTED)) {
      return INTERRUPTED;
    }
    if (code.contains("timeout")) {
      return TIMEOUT;
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
}
