package com.copytrading.engine.api;

import com.copytrading.engine.position.PerformanceSummary;
import java.math.BigDecimal;

public record PerformanceResponse(
    String whaleAddress,
    long totalPositions,
    long activePositions,
    long closedPositions,
    long winningPositions,
    long losingPositions,
    BigDecimal winRate,
    BigDecimal realizedPnl,
    BigDecimal unrealizedPnl,
    BigDecimal totalPnl,
    BigDecimal bestPnl,
    BigDecimal worstPnl) {

  public static PerformanceResponse from(PerformanceSummary summary) {
    return new PerformanceResponse(
        summary.whaleAddress(),
        summary.totalPositions(),
        summary.activePositions(),
        summary.closedPositions(),
        summary.winningPositions(),
        summary.losingPositions(),
        summary.winRate(),
        summary.realizedPnl(),
        summary.unrealizedPnl(),
        summary.totalPnl(),
        summary.bestPnl(),
        summary.worstPnl());
  }
}
