package com.copytrading.integration.polymarket;

import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderType;
import java.math.BigDecimal;
import java.util.Objects;

public record ExchangeOrderRequest(
    String clientOrderId,
    String tokenId,
    OrderSide side,
    OrderType orderType,
    BigDecimal size,
    BigDecimal price) {
  public ExchangeOrderRequest {
    requireNonBlank(clientOrderId, "clientOrderId");
    requireNonBlank(tokenId, "tokenId");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(orderType, "orderType must not be null");
    if (size == null || size.signum() <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    if (orderType.requiresPrice() && price == null) {
      throw new IllegalArgumentException("price is required for " + orderType + " orders");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
