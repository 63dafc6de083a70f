package com.copytrading.engine.api;

import com.copytrading.domain.orders.OrderTransition;
import java.time.Instant;
import java.util.Map;

public record OrderTransitionResponse(
    String fromState, String toState, Instant occurredAt, String reason, Map<String, Object> metadata) {

  public static OrderTransitionResponse from(OrderTransition transition) {
    return new OrderTransitionResponse(
        transition.fromState() == null ? null : transition.fromState().name(),
        transition.toState().name(),
        transition.occurredAt(),
        transition.reason(),
        transition.metadata());
  }
}
