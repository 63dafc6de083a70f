package com.copytrading.engine.sizing;

import java.math.BigDecimal;

/** Every factor of the adaptive Kelly product, kept for the order context and the logs. */
public record SizingResult(
    BigDecimal kellyFraction,
    BigDecimal confidenceFactor,
    BigDecimal volatilityFactor,
    BigDecimal correlationFactor,
    BigDecimal drawdownFactor,
    BigDecimal finalFraction,
    BigDecimal notional,
    BigDecimal size) {
  private static final BigDecimal MIN_SIZE = new BigDecimal("0.01");

  public boolean isTradable() {
    return size.compareTo(MIN_SIZE) >= 0;
  }
}
