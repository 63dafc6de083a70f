package com.copytrading.engine.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Immutable snapshot of portfolio risk. Only {@link RiskManager} builds new snapshots; everyone
 * else reads whatever snapshot was current when they asked.
 */
public record RiskState(
    LocalDate tradingDay,
    BigDecimal baseNav,
    BigDecimal startOfDayNav,
    BigDecimal startOfDayUnrealizedPnl,
    BigDecimal realizedPnlToday,
    BigDecimal realizedPnlTotal,
    BigDecimal navPeak,
    Map<UUID, PositionExposure> positions,
    Map<String, ExposureEntry> reservations,
    boolean halted,
    String haltReason,
    Instant pausedUntil,
    int consecutiveLosses,
    Map<String, BigDecimal> whaleRealizedToday,
    Set<String> blockedWhales,
    Map<String, QuarantineEntry> quarantinedWhales,
    Map<String, List<WhaleScoreObservation>> scoreHistory,
    Map<String, Instant> whaleLastLossAt) {
  private static final int RATIO_SCALE = 8;

  public RiskState {
    Objects.requireNonNull(tradingDay, "tradingDay must not be null");
    Objects.requireNonNull(baseNav, "baseNav must not be null");
    positions = Map.copyOf(positions);
    reservations = Map.copyOf(reservations);
    whaleRealizedToday = Map.copyOf(whaleRealizedToday);
    blockedWhales = Set.copyOf(blockedWhales);
    quarantinedWhales = Map.copyOf(quarantinedWhales);
    scoreHistory = Map.copyOf(scoreHistory);
    whaleLastLossAt = Map.copyOf(whaleLastLossAt);
  }

  public static RiskState initial(BigDecimal nav, LocalDate tradingDay) {
    return new RiskState(
        tradingDay,
        nav,
        nav,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        nav,
        Map.of(),
        Map.of(),
        false,
        null,
        null,
        0,
        Map.of(),
        Set.of(),
        Map.of(),
        Map.of(),
        Map.of());
  }

  public BigDecimal unrealizedPnl() {
    return positions.values().stream()
        .map(PositionExposure::unrealizedPnl)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal nav() {
    return baseNav.add(realizedPnlTotal).add(unrealizedPnl());
  }

  /** Realized P&L today plus the change in unrealized P&L since the day started. */
  public BigDecimal dailyPnl() {
    return realizedPnlToday.add(unrealizedPnl().subtract(startOfDayUnrealizedPnl));
  }

  /** Fractional decline of NAV from its peak, zero at or above the peak. */
  public BigDecimal drawdown() {
    if (navPeak.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal decline = navPeak.subtract(nav());
    if (decline.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return decline.divide(navPeak, RATIO_SCALE, RoundingMode.HALF_UP);
  }

  public List<ExposureEntry> exposures() {
    return Stream.concat(
            positions.values().stream().map(PositionExposure::toEntry),
            reservations.values().stream())
        .toList();
  }

  public BigDecimal openExposure() {
    return sum(exposures().stream());
  }

  public int openPositionCount() {
    return positions.size() + reservations.size();
  }

  public BigDecimal marketExposure(String tokenId) {
    return sum(exposures().stream().filter(entry -> tokenId.equals(entry.tokenId())));
  }

  public BigDecimal whaleExposure(String whaleAddress) {
    return sum(exposures().stream().filter(entry -> whaleAddress.equals(entry.whaleAddress())));
  }

  public BigDecimal categoryExposure(String category) {
    if (category == null) {
      return BigDecimal.ZERO;
    }
    return sum(exposures().stream().filter(entry -> category.equals(entry.category())));
  }

  public boolean isPaused(Instant now) {
    return pausedUntil != null && now.isBefore(pausedUntil);
  }

  public boolean isQuarantined(String whaleAddress) {
    return quarantinedWhales.containsKey(whaleAddress);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  private static BigDecimal sum(Stream<ExposureEntry> entries) {
    return entries.map(ExposureEntry::exposure).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public static final class Builder {
    private LocalDate tradingDay;
    private final BigDecimal baseNav;
    private BigDecimal startOfDayNav;
    private BigDecimal startOfDayUnrealizedPnl;
    private BigDecimal realizedPnlToday;
    private BigDecimal realizedPnlTotal;
    private BigDecimal navPeak;
    private final Map<UUID, PositionExposure> positions;
    private final Map<String, ExposureEntry> reservations;
    private boolean halted;
    private String haltReason;
    private Instant pausedUntil;
    private int consecutiveLosses;
    private final Map<String, BigDecimal> whaleRealizedToday;
    private final Set<String> blockedWhales;
    private final Map<String, QuarantineEntry> quarantinedWhales;
    private final Map<String, List<WhaleScoreObservation>> scoreHistory;
    private final Map<String, Instant> whaleLastLossAt;

    private Builder(RiskState state) {
      this.tradingDay = state.tradingDay;
      this.baseNav = state.baseNav;
      this.startOfDayNav = state.startOfDayNav;
      this.startOfDayUnrealizedPnl = state.startOfDayUnrealizedPnl;
      this.realizedPnlToday = state.realizedPnlToday;
      this.realizedPnlTotal = state.realizedPnlTotal;
      this.navPeak = state.navPeak;
      this.positions = new HashMap<>(state.positions);
      this.reservations = new HashMap<>(state.reservations);
      this.halted = state.halted;
      this.haltReason = state.haltReason;
      this.pausedUntil = state.pausedUntil;
      this.consecutiveLosses = state.consecutiveLosses;
      this.whaleRealizedToday = new HashMap<>(state.whaleRealizedToday);
      this.blockedWhales = new HashSet<>(state.blockedWhales);
      this.quarantinedWhales = new HashMap<>(state.quarantinedWhales);
      this.scoreHistory = new HashMap<>(state.scoreHistory);
      this.whaleLastLossAt = new HashMap<>(state.whaleLastLossAt);
    }

    public Builder tradingDay(LocalDate value) {
      this.tradingDay = value;
      return this;
    }

    public Builder startOfDay(BigDecimal nav, BigDecimal unrealizedPnl) {
      this.startOfDayNav = nav;
      this.startOfDayUnrealizedPnl = unrealizedPnl;
      return this;
    }

    public Builder realizedPnlToday(BigDecimal value) {
      this.realizedPnlToday = value;
      return this;
    }

    public Builder realizedPnl(BigDecimal today, BigDecimal total) {
      this.realizedPnlToday = today;
      this.realizedPnlTotal = total;
      return this;
    }

    public Builder addRealized(BigDecimal value) {
      this.realizedPnlToday = realizedPnlToday.add(value);
      this.realizedPnlTotal = realizedPnlTotal.add(value);
      return this;
    }

    public Builder navPeak(BigDecimal value) {
      this.navPeak = value;
      return this;
    }

    public Builder putPosition(PositionExposure exposure) {
      positions.put(exposure.positionId(), exposure);
      return this;
    }

    public Builder removePosition(UUID positionId) {
      positions.remove(positionId);
      return this;
    }

    public Builder putReservation(String key, ExposureEntry entry) {
      reservations.put(key, entry);
      return this;
    }

    public Builder removeReservation(String key) {
      reservations.remove(key);
      return this;
    }

    public Builder halt(String reason) {
      this.halted = true;
      this.haltReason = reason;
      return this;
    }

    public Builder clearHalt() {
      this.halted = false;
      this.haltReason = null;
      return this;
    }

    public Builder pausedUntil(Instant value) {
      this.pausedUntil = value;
      return this;
    }

    public Builder consecutiveLosses(int value) {
      this.consecutiveLosses = value;
      return this;
    }

    public Builder addWhaleRealized(String whaleAddress, BigDecimal value) {
      whaleRealizedToday.merge(whaleAddress, value, BigDecimal::add);
      return this;
    }

    public Builder clearWhaleDailyCounters() {
      whaleRealizedToday.clear();
      blockedWhales.clear();
      return this;
    }

    public Builder blockWhale(String whaleAddress) {
      blockedWhales.add(whaleAddress);
      return this;
    }

    public Builder quarantine(QuarantineEntry entry) {
      quarantinedWhales.put(entry.whaleAddress(), entry);
      return this;
    }

    public Builder release(String whaleAddress) {
      quarantinedWhales.remove(whaleAddress);
      return this;
    }

    public Builder scoreHistory(String whaleAddress, List<WhaleScoreObservation> observations) {
      scoreHistory.put(whaleAddress, List.copyOf(new ArrayList<>(observations)));
      return this;
    }

    public Builder whaleLastLossAt(String whaleAddress, Instant value) {
      whaleLastLossAt.put(whaleAddress, value);
      return this;
    }

    public RiskState build() {
      return new RiskState(
          tradingDay,
          baseNav,
          startOfDayNav,
          startOfDayUnrealizedPnl,
          realizedPnlToday,
          realizedPnlTotal,
          navPeak,
          positions,
          reservations,
          halted,
          haltReason,
          pausedUntil,
          consecutiveLosses,
          whaleRealizedToday,
          blockedWhales,
          quarantinedWhales,
          scoreHistory,
          whaleLastLossAt);
    }
  }
}
