package com.copytrading.engine.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The part of {@link RiskState} that must survive a restart. Open positions are rebuilt from the
 * ledger and reservations from live orders, so neither is stored here.
 */
public record PersistedRiskState(
    LocalDate tradingDay,
    BigDecimal startOfDayNav,
    BigDecimal startOfDayUnrealizedPnl,
    BigDecimal realizedPnlToday,
    BigDecimal realizedPnlTotal,
    BigDecimal navPeak,
    boolean halted,
    String haltReason,
    Instant pausedUntil,
    int consecutiveLosses,
    Map<String, BigDecimal> whaleRealizedToday,
    Set<String> blockedWhales,
    Map<String, Instant> whaleLastLossAt,
    Map<String, List<WhaleScoreObservation>> scoreHistory,
    Map<String, QuarantineEntry> quarantinedWhales) {
  public PersistedRiskState {
    Objects.requireNonNull(tradingDay, "tradingDay must not be null");
    whaleRealizedToday = Map.copyOf(whaleRealizedToday);
    blockedWhales = Set.copyOf(blockedWhales);
    whaleLastLossAt = Map.copyOf(whaleLastLossAt);
    scoreHistory = Map.copyOf(scoreHistory);
    quarantinedWhales = Map.copyOf(quarantinedWhales);
  }

  public static PersistedRiskState from(RiskState state) {
    return new PersistedRiskState(
        state.tradingDay(),
        state.startOfDayNav(),
        state.startOfDayUnrealizedPnl(),
        state.realizedPnlToday(),
        state.realizedPnlTotal(),
        state.navPeak(),
        state.halted(),
        state.haltReason(),
        state.pausedUntil(),
        state.consecutiveLosses(),
        state.whaleRealizedToday(),
        state.blockedWhales(),
        state.whaleLastLossAt(),
        state.scoreHistory(),
        state.quarantinedWhales());
  }

  /** Lays the stored values over a fresh state that carries the configured base NAV. */
  RiskState restoreOnto(RiskState fresh) {
    RiskState.Builder builder =
        fresh.toBuilder()
            .tradingDay(tradingDay)
            .startOfDay(startOfDayNav, startOfDayUnrealizedPnl)
            .realizedPnl(realizedPnlToday, realizedPnlTotal)
            .navPeak(navPeak)
            .pausedUntil(pausedUntil)
            .consecutiveLosses(consecutiveLosses);
    if (halted) {
      builder.halt(haltReason);
    }
    whaleRealizedToday.forEach(builder::addWhaleRealized);
    blockedWhales.forEach(builder::blockWhale);
    whaleLastLossAt.forEach(builder::whaleLastLossAt);
    scoreHistory.forEach(builder::scoreHistory);
    quarantinedWhales.values().forEach(builder::quarantine);
    return builder.build();
  }
}
