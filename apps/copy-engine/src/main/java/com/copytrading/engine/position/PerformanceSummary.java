package com.copytrading.engine.position;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Aggregate P&L over the ledger, or over one whale's positions when {@code whaleAddress} is set. */
public record PerformanceSummary(
    String whaleAddress,
    long totalPositions,
    long activePositions,
    long closedPositions,
    long winningPositions,
    long losingPositions,
    BigDecimal realizedPnl,
    BigDecimal unrealizedPnl,
    BigDecimal bestPnl,
    BigDecimal worstPnl) {

  public BigDecimal totalPnl() {
    return realizedPnl.add(unrealizedPnl);
  }

  public BigDecimal winRate() {
    if (closedPositions == 0) {
      return BigDecimal.ZERO;
    }
    return BigDecimal.valueOf(winningPositions)
        .divide(BigDecimal.valueOf(closedPositions), 4, RoundingMode.HALF_UP);
  }
}
