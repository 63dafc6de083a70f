package com.copytrading.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Copy-trading context carried by an order so that a confirmed fill can open, grow or reduce the
 * right position without looking the originating signal up again.
 */
public record OrderContext(
    OrderPurpose purpose,
    String whaleAddress,
    UUID positionId,
    String closeReason,
    String category,
    BigDecimal kellyFraction,
    BigDecimal edge,
    BigDecimal winRate,
    BigDecimal stopLossPrice,
    BigDecimal takeProfitPrice,
    Instant marketEndsAt) {
  public OrderContext {
    Objects.requireNonNull(purpose, "purpose must not be null");
    if (whaleAddress == null || whaleAddress.isBlank()) {
      throw new OrderDomainException("whaleAddress must not be blank");
    }
    if (purpose == OrderPurpose.CLOSE_POSITION) {
      if (positionId == null) {
        throw new OrderDomainException("positionId is required for closing orders");
      }
      if (closeReason == null || closeReason.isBlank()) {
        throw new OrderDomainException("closeReason is required for closing orders");
      }
    }
  }

  public static OrderContext opening(
      String whaleAddress,
      String category,
      BigDecimal kellyFraction,
      BigDecimal edge,
      BigDecimal winRate,
      BigDecimal stopLossPrice,
      BigDecimal takeProfitPrice,
      Instant marketEndsAt) {
    return new OrderContext(
        OrderPurpose.OPEN_POSITION,
        whaleAddress,
        null,
        null,
        category,
        kellyFraction,
        edge,
        winRate,
        stopLossPrice,
        takeProfitPrice,
        marketEndsAt);
  }

  public static OrderContext closing(String whaleAddress, UUID positionId, String closeReason) {
    return new OrderContext(
        OrderPurpose.CLOSE_POSITION,
        whaleAddress,
        positionId,
        closeReason,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  public OrderContext withPositionId(UUID nextPositionId) {
    return new OrderContext(
        purpose,
        whaleAddress,
        nextPositionId,
        closeReason,
        category,
        kellyFraction,
        edge,
        winRate,
        stopLossPrice,
        takeProfitPrice,
        marketEndsAt);
  }

  public boolean isClosing() {
    return purpose == OrderPurpose.CLOSE_POSITION;
  }
}
