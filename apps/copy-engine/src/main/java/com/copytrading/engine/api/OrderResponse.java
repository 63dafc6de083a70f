package com.copytrading.engine.api;

import com.copytrading.domain.orders.Order;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record OrderResponse(
    UUID id,
    String idempotencyKey,
    String tokenId,
    String side,
    String type,
    BigDecimal size,
    BigDecimal price,
    String state,
    BigDecimal filledSize,
    BigDecimal avgFillPrice,
    String exchangeOrderId,
    int retryCount,
    String errorMessage,
    String purpose,
    String whaleAddress,
    UUID positionId,
    UUID parentOrderId,
    Instant createdAt,
    Instant updatedAt) {

  public static OrderResponse from(Order order) {
    return new OrderResponse(
        order.orderId(),
        order.idempotencyKey(),
        order.tokenId(),
        order.side().name(),
        order.orderType().name(),
        order.size(),
        order.price(),
        order.state().name(),
        order.filledSize(),
        order.avgFillPrice(),
        order.exchangeOrderId(),
        order.retryCount(),
        order.errorMessage(),
        order.context().purpose().name(),
        order.context().whaleAddress(),
        order.context().positionId(),
        order.parentOrderId(),
        order.createdAt(),
        order.updatedAt());
  }
}
