package com.copytrading.engine.order;

import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderType;
import java.math.BigDecimal;
import java.util.Objects;

public record SubmitOrderCommand(
    String idempotencyKey,
    String tokenId,
    OrderSide side,
    OrderType orderType,
    BigDecimal size,
    BigDecimal price,
    OrderContext context) {
  public SubmitOrderCommand {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      throw new IllegalArgumentException("idempotencyKey must not be blank");
    }
    if (tokenId == null || tokenId.isBlank()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(orderType, "orderType must not be null");
    Objects.requireNonNull(size, "size must not be null");
    Objects.requireNonNull(context, "context must not be null");
  }
}
