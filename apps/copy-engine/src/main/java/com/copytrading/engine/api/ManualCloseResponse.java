package com.copytrading.engine.api;

import com.copytrading.domain.orders.Order;
import java.util.UUID;

public record ManualCloseResponse(UUID positionId, UUID orderId, String orderState) {

  public static ManualCloseResponse from(UUID positionId, Order order) {
    return new ManualCloseResponse(positionId, order.orderId(), order.state().name());
  }
}
