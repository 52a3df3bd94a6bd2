package com.designauditor.crawl.util;

import com.designauditor.crawl.model.HttpFetchResult;
import com.designauditor.crawl.service.AnalysisCancelledException;
import com.designauditor.crawl.service.PageAnalysisException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FailureReasonClassifier {
  public static final String SESSION_TIMEOUT = "SESSION_TIMEOUT";
  public static final String SESSION_CREATION_FAILED = "SESSION_CREATION_FAILED";
  public static final String EXTRACTION_ERROR = "EXTRACTION_ERROR";
  public static final String CANCELLED = "CANCELLED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String NOT_HTML = "NOT_HTML";
  public static final String UNKNOWN = "UNKNOWN";

  private FailureReasonClassifier() {}

  public static String fromException(Throwable error) {
    if (error == null) {
      return UNKNOWN;
    }
    if (error instanceof PageAnalysisException pageError) {
      return pageError.reasonCode();
    }
    if (error instanceof AnalysisCancelledException) {
      return CANCELLED;
    }
    if (error instanceof TimeoutException) {
      return SESSION_TIMEOUT;
    }
    return UNKNOWN;
  }

  public static String fromFetch(HttpFetchResult fetch) {
    if (fetch == null) {
      return UNKNOWN;
    }
    if (fetch.errorCode() != null) {
      return fromErrorCode(fetch.errorCode(), fetch.errorMessage());
    }
    return fromHttpStatus(fetch.statusCode());
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
      return UNKNOWN;
    }
    if (code.contains("not_html")) {
      return NOT_HTML;
    }
    Integer httpStatus = parseHttpStatus(code);
    if (httpStatus != null) {
      return fromHttpStatus(httpStatus);
    }
    return UNKNOWN;
  }

  /** Page-level failures that are worth another attempt with a larger budget. */
  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case SESSION_TIMEOUT, SESSION_CREATION_FAILED, EXTRACTION_ERROR, UNKNOWN -> true;
      default -> false;
    };
  }

  public static Integer parseHttpStatus(String key) {
    if (key == null || key.isBlank()) {
      return null;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    int idx = lower.lastIndexOf("http_");
    if (idx < 0) {
      return null;
    }
    String tail = lower.substring(idx + 5);
    int end = 0;
    while (end < tail.length() && Character.isDigit(tail.charAt(end))) {
      end++;
    }
    if (end == 0) {
      return null;
    }
    try {
      return Integer.parseInt(tail.substring(0, end));
    } catch (NumberFormatException ignored) {
      return null;
    }
  }
}
