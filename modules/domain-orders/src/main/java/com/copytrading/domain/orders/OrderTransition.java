package com.copytrading.domain.orders;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record OrderTransition(
    UUID id,
    UUID orderId,
    OrderState fromState,
    OrderState toState,
    Instant occurredAt,
    String reason,
    Map<String, Object> metadata) {
  public OrderTransition {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(orderId, "orderId must not be null");
    Objects.requireNonNull(toState, "toState must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static OrderTransition of(
      Order before, Order after, String reason, Map<String, Object> metadata) {
    return new OrderTransition(
        UUID.randomUUID(),
        after.orderId(),
        before == null ? null : before.state(),
        after.state(),
        after.updatedAt(),
        reason,
        metadata);
  }
}
