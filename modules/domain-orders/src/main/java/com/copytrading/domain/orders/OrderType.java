package com.copytrading.domain.orders;

public enum OrderType {
  LIMIT,
  MARKET,
  FOK,
  GTC;

  public boolean requiresPrice() {
    return this != MARKET;
  }
}
