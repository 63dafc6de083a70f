package com.copytrading.integration.polymarket;

public enum ExchangeErrorCode {
  CONNECTION(true),
  TIMEOUT(true),
  RATE_LIMITED(true),
  SERVER_ERROR(true),
  INSUFFICIENT_BALANCE(false),
  INVALID_MARKET(false),
  PRICE_OUT_OF_BOUNDS(false),
  ORDER_NOT_FOUND(false),
  UNAUTHORIZED(false),
  REJECTED(false);

  private final boolean transientError;

  ExchangeErrorCode(boolean transientError) {
    this.transientError = transientError;
  }

  public boolean isTransient() {
    return transientError;
  }

  /** Maps an HTTP status to an error code; 4xx bodies are refined by {@link #fromErrorMessage}. */
  public static ExchangeErrorCode fromHttpStatus(int statusCode, String errorMessage) {
    if (statusCode == 429) {
      return RATE_LIMITED;
    }
    if (statusCode >= 500) {
      return SERVER_ERROR;
    }
    if (statusCode == 401 || statusCode == 403) {
      return UNAUTHORIZED;
    }
    if (statusCode == 404) {
      return ORDER_NOT_FOUND;
    }
    if (statusCode == 408) {
      return TIMEOUT;
    }
    return fromErrorMessage(errorMessage);
  }

  public static ExchangeErrorCode fromErrorMessage(String errorMessage) {
    if (errorMessage == null || errorMessage.isBlank()) {
      return REJECTED;
    }
    String normalized = errorMessage.toLowerCase();
    if (normalized.contains("balance") || normalized.contains("allowance")) {
      return INSUFFICIENT_BALANCE;
    }
    if (normalized.contains("tick") || normalized.contains("price")) {
      return PRICE_OUT_OF_BOUNDS;
    }
    if (normalized.contains("market") || normalized.contains("token")) {
      return INVALID_MARKET;
    }
    return REJECTED;
  }
}
