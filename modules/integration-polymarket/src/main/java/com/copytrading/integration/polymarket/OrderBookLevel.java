package com.copytrading.integration.polymarket;

import java.math.BigDecimal;

public record OrderBookLevel(BigDecimal price, BigDecimal size) {
  public OrderBookLevel {
    if (price == null || price.signum() <= 0) {
      throw new IllegalArgumentException("price must be > 0");
    }
    if (size == null || size.signum() <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
  }
}
