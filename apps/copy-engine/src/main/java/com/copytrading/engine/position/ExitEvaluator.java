package com.copytrading.engine.position;

import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Checks exit triggers in the configured priority order and reports the first one met. Only OPEN
 * positions are evaluated; a CLOSING position already has its exit in flight.
 */
@Component
public class ExitEvaluator {
  private static final int PRICE_SCALE = 6;

  private final ExitProperties properties;

  public ExitEvaluator(ExitProperties properties) {
    this.properties = properties;
  }

  public Optional<ExitTrigger> evaluate(
      Position position, BigDecimal price, Instant now, boolean whaleExited) {
    if (position.status() != PositionStatus.OPEN) {
      return Optional.empty();
    }
    for (ExitTrigger trigger : properties.getPriority()) {
      if (isMet(trigger, position, price, now, whaleExited)) {
        return Optional.of(trigger);
      }
    }
    return Optional.empty();
  }

  public BigDecimal stopLossFor(OrderSide openingSide, BigDecimal entryPrice) {
    BigDecimal ratio = properties.getStopLossRatio();
    BigDecimal factor =
        openingSide == OrderSide.BUY ? BigDecimal.ONE.subtract(ratio) : BigDecimal.ONE.add(ratio);
    return clampPrice(entryPrice.multiply(factor));
  }

  public BigDecimal takeProfitFor(OrderSide openingSide, BigDecimal entryPrice) {
    BigDecimal ratio = properties.getTakeProfitRatio();
    BigDecimal factor =
        openingSide == OrderSide.BUY ? BigDecimal.ONE.add(ratio) : BigDecimal.ONE.subtract(ratio);
    return clampPrice(entryPrice.multiply(factor));
  }

  private boolean isMet(
      ExitTrigger trigger, Position position, BigDecimal price, Instant now, boolean whaleExited) {
    return switch (trigger) {
      case STOP_LOSS -> position.isStopLossHit(price);
      case TAKE_PROFIT -> position.isTakeProfitHit(price);
      case PRE_RESOLUTION -> isNearResolution(position, now);
      case WHALE_EXIT -> whaleExited;
    };
  }

  private boolean isNearResolution(Position position, Instant now) {
    if (position.marketEndsAt() == null) {
      return false;
    }
    Instant windowStart =
        position.marketEndsAt().minus(Duration.ofMinutes(properties.getPreResolutionWindowMinutes()));
    return !now.isBefore(windowStart);
  }

  private static BigDecimal clampPrice(BigDecimal price) {
    return price
        .setScale(PRICE_SCALE, RoundingMode.HALF_UP)
        .max(Position.MIN_PRICE)
        .min(Position.MAX_PRICE);
  }
}
