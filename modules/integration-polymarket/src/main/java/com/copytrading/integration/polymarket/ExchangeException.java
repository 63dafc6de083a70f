package com.copytrading.integration.polymarket;

import java.util.Objects;
import java.util.Optional;
import org.springframework.http.HttpHeaders;

public class ExchangeException extends RuntimeException {
  private final ExchangeErrorCode errorCode;
  private final int statusCode;
  private final HttpHeaders responseHeaders;
  private final String responseBody;

  public ExchangeException(ExchangeErrorCode errorCode, String message) {
    this(errorCode, message, 0, null, null, null);
  }

  public ExchangeException(ExchangeErrorCode errorCode, String message, Throwable cause) {
    this(errorCode, message, 0, null, null, cause);
  }

  public ExchangeException(
      ExchangeErrorCode errorCode,
      String message,
      int statusCode,
      HttpHeaders responseHeaders,
      String responseBody,
      Throwable cause) {
    super("Exchange error code=" + errorCode + " status=" + statusCode + ": " + message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    this.statusCode = statusCode;
    this.responseHeaders =
        HttpHeaders.readOnlyHttpHeaders(
            responseHeaders == null ? HttpHeaders.EMPTY : responseHeaders);
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  public ExchangeErrorCode errorCode() {
    return errorCode;
  }

  public int statusCode() {
    return statusCode;
  }

  public String responseBody() {
    return responseBody;
  }

  public boolean isTransient() {
    return errorCode.isTransient();
  }

  public boolean isRateLimitError() {
    return errorCode == ExchangeErrorCode.RATE_LIMITED;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(responseHeaders.getFirst(HttpHeaders.RETRY_AFTER));
  }
}
