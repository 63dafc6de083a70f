package com.copytrading.domain.orders;

public enum OrderSide {
  BUY,
  SELL;

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }
}
