package com.copytrading.domain.orders;

public enum OrderState {
  PENDING,
  SUBMITTED,
  PARTIALLY_FILLED,
  FILLED,
  CONFIRMED,
  CANCELLED,
  FAILED,
  DEAD_LETTER;

  public boolean isTerminal() {
    return this == CONFIRMED || this == CANCELLED || this == DEAD_LETTER;
  }

  public boolean isOpenAtExchange() {
    return this == SUBMITTED || this == PARTIALLY_FILLED;
  }

  public boolean hasFills() {
    return this == PARTIALLY_FILLED || this == FILLED;
  }
}
