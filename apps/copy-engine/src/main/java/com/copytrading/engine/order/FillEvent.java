package com.copytrading.engine.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One execution against an exchange order, whether pushed by the fill feed or derived from a REST
 * poll. {@code sequence} numbers the order's fills the same way on both paths.
 */
public record FillEvent(
    String exchangeOrderId,
    long sequence,
    BigDecimal size,
    BigDecimal price,
    Instant filledAt,
    FillSource source) {
  public FillEvent {
    if (exchangeOrderId == null || exchangeOrderId.isBlank()) {
      throw new IllegalArgumentException("exchangeOrderId must not be blank");
    }
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be >= 0");
    }
    Objects.requireNonNull(size, "size must not be null");
    Objects.requireNonNull(price, "price must not be null");
    Objects.requireNonNull(filledAt, "filledAt must not be null");
    Objects.requireNonNull(source, "source must not be null");
  }
}
