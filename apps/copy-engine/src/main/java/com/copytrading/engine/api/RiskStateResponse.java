package com.copytrading.engine.api;

import com.copytrading.engine.risk.RiskState;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RiskStateResponse(
    LocalDate tradingDay,
    BigDecimal nav,
    BigDecimal navPeak,
    BigDecimal drawdown,
    BigDecimal dailyPnl,
    BigDecimal realizedPnlTotal,
    BigDecimal unrealizedPnl,
    BigDecimal openExposure,
    int openPositions,
    boolean halted,
    String haltReason,
    Instant pausedUntil,
    int consecutiveLosses,
    List<String> blockedWhales,
    List<String> quarantinedWhales) {

  public static RiskStateResponse from(RiskState state) {
    return new RiskStateResponse(
        state.tradingDay(),
        state.nav(),
        state.navPeak(),
        state.drawdown(),
        state.dailyPnl(),
        state.realizedPnlTotal(),
        state.unrealizedPnl(),
        state.openExposure(),
        state.openPositionCount(),
        state.halted(),
        state.haltReason(),
        state.pausedUntil(),
        state.consecutiveLosses(),
        state.blockedWhales().stream().sorted().toList(),
        state.quarantinedWhales().keySet().stream().sorted().toList());
  }
}
