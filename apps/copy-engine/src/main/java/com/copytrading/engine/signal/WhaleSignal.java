package com.copytrading.engine.signal;

import com.copytrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record WhaleSignal(
    String tradeId,
    String whaleAddress,
    String tokenId,
    String marketId,
    String category,
    OrderSide side,
    BigDecimal size,
    BigDecimal price,
    BigDecimal lastPrice,
    Instant marketEndsAt,
    Instant tradedAt,
    WhaleMetrics metrics) {
  public WhaleSignal {
    requireNonBlank(tradeId, "tradeId");
    requireNonBlank(whaleAddress, "whaleAddress");
    requireNonBlank(tokenId, "tokenId");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(size, "size must not be null");
    Objects.requireNonNull(price, "price must not be null");
    if (size.signum() <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    if (price.signum() <= 0 || price.compareTo(BigDecimal.ONE) >= 0) {
      throw new IllegalArgumentException("price must be within (0, 1)");
    }
    metrics = metrics == null ? new WhaleMetrics(null, null, null, null, null) : metrics;
  }

  public BigDecimal notional() {
    return size.multiply(price);
  }

  /** Last traded price when known, otherwise the whale's own fill price. */
  public BigDecimal referencePrice() {
    return lastPrice == null ? price : lastPrice;
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
