package com.copytrading.engine.risk;

import com.copytrading.engine.audit.AuditTrail;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Single writer of {@link RiskState}. Every mutation runs under one lock and publishes a fresh
 * snapshot; reads never block.
 */
@Service
public class RiskManager {
  private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

  static final String DECISIONS_METRIC = "copytrading.risk.decisions.total";
  static final String BREAKER_METRIC = "copytrading.risk.breaker.trips.total";
  static final String HALT_DAILY_LOSS = "DAILY_LOSS_LIMIT";
  static final String HALT_WHALE_LOSS = "WHALE_LOSS_LIMIT";
  private static final String ACTOR = "risk-manager";

  private final RiskProperties properties;
  private final RiskStateRepository repository;
  private final AuditTrail auditTrail;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicReference<RiskState> state;
  private PersistedRiskState lastPersisted;

  @Autowired
  public RiskManager(
      RiskProperties properties,
      RiskStateRepository repository,
      AuditTrail auditTrail,
      MeterRegistry meterRegistry) {
    this(properties, repository, auditTrail, meterRegistry, Clock.systemUTC());
  }

  RiskManager(
      RiskProperties properties,
      RiskStateRepository repository,
      AuditTrail auditTrail,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.properties = properties;
    this.repository = repository;
    this.auditTrail = auditTrail;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.state =
        new AtomicReference<>(RiskState.initial(properties.getStartingNav(), today(clock.instant())));
  }

  public RiskState snapshot() {
    return state.get();
  }

  /** Size multiplier of the REDUCE tier: below 1 while NAV drawdown from peak is at the threshold. */
  public BigDecimal riskMultiplier() {
    return riskMultiplier(state.get());
  }

  /**
   * Rebuilds the state after a restart: breaker tiers, P&L counters and quarantine come from the
   * last persisted snapshot, open positions from the ledger. Rolls the trading day afterwards so a
   * snapshot from an earlier day starts a fresh loss budget.
   */
  public RiskState restore(List<PositionExposure> positions) {
    RiskState restored;
    boolean stored;
    writeLock.lock();
    try {
      RiskState fresh = RiskState.initial(properties.getStartingNav(), today(clock.instant()));
      Optional<PersistedRiskState> persisted = repository.load();
      stored = persisted.isPresent();
      RiskState.Builder builder =
          persisted.map(snapshot -> snapshot.restoreOnto(fresh)).orElse(fresh).toBuilder();
      positions.forEach(builder::putPosition);
      state.get().reservations().forEach(builder::putReservation);
      lastPersisted = persisted.orElse(null);
      publish(builder.build());
      rollTradingDayIfNeeded();
      restored = state.get();
    } finally {
      writeLock.unlock();
    }
    log.info(
        "Risk state restored fromSnapshot={} positions={} nav={} halted={} haltReason={}"
            + " pausedUntil={} quarantined={}",
        stored,
        positions.size(),
        restored.nav(),
        restored.halted(),
        restored.haltReason(),
        restored.pausedUntil(),
        restored.quarantinedWhales().size());
    return restored;
  }

  public boolean isQuarantined(String whaleAddress) {
    return state.get().isQuarantined(whaleAddress);
  }

  /** Checks the intent against the latest state and, on approval, reserves the notional. */
  public RiskDecision approve(TradeIntent intent, BigDecimal notional) {
    Objects.requireNonNull(intent, "intent must not be null");
    RiskDecision decision;
    writeLock.lock();
    try {
      rollTradingDayIfNeeded();
      RiskState current = state.get();
      decision = evaluate(current, intent, notional, clock.instant());
      if (decision.approved()) {
        publish(
            current.toBuilder()
                .putReservation(
                    intent.reservationKey(),
                    new ExposureEntry(
                        intent.whaleAddress(), intent.tokenId(), intent.category(), notional))
                .build());
      }
    } finally {
      writeLock.unlock();
    }
    meterRegistry
        .counter(
            DECISIONS_METRIC,
            "outcome",
            decision.approved() ? "approved" : "vetoed",
            "code",
            decision.code().name())
        .increment();
    if (decision.approved()) {
      log.info(
          "Risk approved reservationKey={} whale={} token={} notional={}",
          intent.reservationKey(),
          intent.whaleAddress(),
          intent.tokenId(),
          notional);
    } else {
      log.warn(
          "Risk veto reservationKey={} whale={} token={} notional={} code={} reason={}",
          intent.reservationKey(),
          intent.whaleAddress(),
          intent.tokenId(),
          notional,
          decision.code(),
          decision.reason());
    }
    return decision;
  }

  /** Same checks as {@link #approve} without reserving anything. */
  public RiskDecision preview(TradeIntent intent, BigDecimal notional) {
    return evaluate(state.get(), intent, notional, clock.instant());
  }

  public void releaseReservation(String reservationKey) {
    if (!state.get().reservations().containsKey(reservationKey)) {
      return;
    }
    mutate(builder -> builder.removeReservation(reservationKey));
  }

  /** Re-holds the notional of an opening order that was still working when the engine stopped. */
  public void restoreReservation(String reservationKey, ExposureEntry entry) {
    mutate(builder -> builder.putReservation(reservationKey, entry));
  }

  public void syncPosition(PositionExposure exposure) {
    mutate(builder -> builder.putPosition(exposure));
  }

  public void recordRealizedPnl(String whaleAddress, BigDecimal realizedDelta) {
    if (realizedDelta == null || realizedDelta.signum() == 0) {
      return;
    }
    mutate(builder -> builder.addRealized(realizedDelta).addWhaleRealized(whaleAddress, realizedDelta));
  }

  /** A full close counts toward the consecutive-loss tier when its total realized P&L is negative. */
  public void recordPositionClosed(UUID positionId, String whaleAddress, BigDecimal totalRealizedPnl) {
    Instant now = clock.instant();
    boolean loss = totalRealizedPnl != null && totalRealizedPnl.signum() < 0;
    mutate(
        builder -> {
          builder.removePosition(positionId);
          if (loss) {
            builder
                .consecutiveLosses(state.get().consecutiveLosses() + 1)
                .whaleLastLossAt(whaleAddress, now);
          } else {
            builder.consecutiveLosses(0);
          }
          return builder;
        });
  }

  public QuarantineChange observeWhaleScore(WhaleScoreObservation observation) {
    RiskProperties.Quarantine config = properties.getQuarantine();
    QuarantineChange change;
    String reason;
    writeLock.lock();
    try {
      RiskState current = state.get();
      String whale = observation.whaleAddress();
      Instant windowStart =
          observation.observedAt().minus(Duration.ofDays(config.getScoreLookbackDays()));
      List<WhaleScoreObservation> history = new ArrayList<>();
      for (WhaleScoreObservation previous : current.scoreHistory().getOrDefault(whale, List.of())) {
        if (previous.observedAt().isAfter(windowStart)) {
          history.add(previous);
        }
      }
      history.add(observation);
      BigDecimal maxScore =
          history.stream()
              .map(WhaleScoreObservation::score)
              .reduce(observation.score(), BigDecimal::max);

      reason = quarantineReason(observation, maxScore, config);
      RiskState.Builder builder = current.toBuilder().scoreHistory(whale, history);
      if (reason != null && !current.isQuarantined(whale)) {
        builder.quarantine(
            new QuarantineEntry(whale, reason, observation.score(), observation.observedAt()));
        change = QuarantineChange.ENTERED;
      } else if (reason == null
          && current.isQuarantined(whale)
          && canRelease(current, observation, config)) {
        builder.release(whale);
        change = QuarantineChange.RELEASED;
      } else {
        change = QuarantineChange.UNCHANGED;
      }
      publish(builder.build());
    } finally {
      writeLock.unlock();
    }

    if (change == QuarantineChange.ENTERED) {
      log.warn(
          "Whale quarantined whale={} score={} reason={}",
          observation.whaleAddress(),
          observation.score(),
          reason);
      auditTrail.recordEvent(
          ACTOR,
          "WHALE_QUARANTINED",
          AuditTrail.ENTITY_WHALE,
          observation.whaleAddress(),
          null,
          null,
          Map.of("score", observation.score(), "reason", reason));
    } else if (change == QuarantineChange.RELEASED) {
      log.info(
          "Whale released from quarantine whale={} score={}",
          observation.whaleAddress(),
          observation.score());
      auditTrail.recordEvent(
          ACTOR,
          "WHALE_RELEASED",
          AuditTrail.ENTITY_WHALE,
          observation.whaleAddress(),
          null,
          null,
          Map.of("score", observation.score()));
    }
    return change;
  }

  /** Operator reset of the HALT and PAUSE tiers. */
  public RiskState resetCircuitBreaker(String actor) {
    RiskState before;
    RiskState after;
    writeLock.lock();
    try {
      rollTradingDayIfNeeded();
      before = state.get();
      // The loss budget restarts from the current NAV so the next mark does not re-trip the halt.
      after =
          before.toBuilder()
              .clearHalt()
              .pausedUntil(null)
              .consecutiveLosses(0)
              .startOfDay(before.nav(), before.unrealizedPnl())
              .realizedPnlToday(BigDecimal.ZERO)
              .build();
      publish(after);
    } finally {
      writeLock.unlock();
    }
    log.info(
        "Circuit breaker reset actor={} previousHaltReason={} previousPausedUntil={}",
        actor,
        before.haltReason(),
        before.pausedUntil());
    Map<String, Object> previous = new LinkedHashMap<>();
    previous.put("halted", before.halted());
    previous.put("haltReason", before.haltReason());
    previous.put("pausedUntil", before.pausedUntil());
    previous.put("consecutiveLosses", before.consecutiveLosses());
    auditTrail.recordEvent(
        actor == null ? "unknown" : actor,
        "CIRCUIT_BREAKER_RESET",
        AuditTrail.ENTITY_RISK,
        "circuit-breaker",
        previous,
        Map.of("halted", false),
        Map.of());
    return after;
  }

  /** Starts a new trading day when the UTC date has moved past the state's day. */
  public boolean rollTradingDay() {
    writeLock.lock();
    try {
      return rollTradingDayIfNeeded();
    } finally {
      writeLock.unlock();
    }
  }

  private boolean rollTradingDayIfNeeded() {
    RiskState current = state.get();
    LocalDate today = today(clock.instant());
    if (!today.isAfter(current.tradingDay())) {
      return false;
    }
    RiskState.Builder builder =
        current.toBuilder()
            .tradingDay(today)
            .startOfDay(current.nav(), current.unrealizedPnl())
            .realizedPnlToday(BigDecimal.ZERO)
            .clearWhaleDailyCounters();
    if (current.halted()
        && (HALT_DAILY_LOSS.equals(current.haltReason())
            || HALT_WHALE_LOSS.equals(current.haltReason()))) {
      builder.clearHalt();
    }
    publish(builder.build());
    log.info(
        "Trading day rolled tradingDay={} startOfDayNav={} previousDailyPnl={}",
        today,
        current.nav(),
        current.dailyPnl());
    return true;
  }

  private RiskState mutate(UnaryOperator<RiskState.Builder> mutation) {
    List<String> trips = new ArrayList<>();
    RiskState next;
    writeLock.lock();
    try {
      rollTradingDayIfNeeded();
      RiskState afterMutation = mutation.apply(state.get().toBuilder()).build();
      next = applyBreakers(afterMutation, trips);
      publish(next);
    } finally {
      writeLock.unlock();
    }
    for (String trip : trips) {
      meterRegistry.counter(BREAKER_METRIC, "tier", trip).increment();
      auditTrail.recordEvent(
          ACTOR,
          "CIRCUIT_BREAKER_" + trip,
          AuditTrail.ENTITY_RISK,
          "circuit-breaker",
          null,
          null,
          breakerMetadata(next));
    }
    return next;
  }

  private RiskState applyBreakers(RiskState candidate, List<String> trips) {
    RiskState.Builder builder = candidate.toBuilder();
    BigDecimal nav = candidate.nav();
    if (nav.compareTo(candidate.navPeak()) > 0) {
      builder.navPeak(nav);
    }

    BigDecimal dailyLoss = candidate.dailyPnl().negate();
    BigDecimal pctLimit =
        candidate.startOfDayNav().multiply(properties.getDailyLossLimitRatio());
    boolean halted = candidate.halted();
    if (!halted
        && (dailyLoss.compareTo(properties.getDailyLossLimitUsd()) >= 0
            || dailyLoss.compareTo(pctLimit) >= 0)) {
      halted = true;
      builder.halt(HALT_DAILY_LOSS);
      trips.add("HALT");
      log.warn(
          "Circuit breaker HALT dailyPnl={} limitUsd={} limitPct={}",
          candidate.dailyPnl(),
          properties.getDailyLossLimitUsd(),
          pctLimit);
    }

    for (Map.Entry<String, BigDecimal> entry : candidate.whaleRealizedToday().entrySet()) {
      if (entry.getValue().negate().compareTo(properties.getWhaleDailyLossLimitUsd()) > 0
          && !candidate.blockedWhales().contains(entry.getKey())) {
        builder.blockWhale(entry.getKey());
        trips.add("WHALE_BLOCK");
        log.warn(
            "Whale blocked for the trading day whale={} realizedToday={}",
            entry.getKey(),
            entry.getValue());
        if (!halted) {
          halted = true;
          builder.halt(HALT_WHALE_LOSS);
          trips.add("HALT");
          log.warn(
              "Circuit breaker HALT whale={} realizedToday={} limitUsd={}",
              entry.getKey(),
              entry.getValue(),
              properties.getWhaleDailyLossLimitUsd());
        }
      }
    }

    if (candidate.consecutiveLosses() >= properties.getMaxConsecutiveLosses()) {
      Instant until = clock.instant().plus(Duration.ofMinutes(properties.getPauseMinutes()));
      builder.pausedUntil(until).consecutiveLosses(0);
      trips.add("PAUSE");
      log.warn(
          "Circuit breaker PAUSE consecutiveLosses={} pausedUntil={}",
          candidate.consecutiveLosses(),
          until);
    }
    return builder.build();
  }

  /** Saves the durable part before the snapshot becomes visible. Caller holds the write lock. */
  private void publish(RiskState next) {
    PersistedRiskState persisted = PersistedRiskState.from(next);
    if (!persisted.equals(lastPersisted)) {
      repository.save(persisted, clock.instant());
      lastPersisted = persisted;
    }
    state.set(next);
  }

  private RiskDecision evaluate(
      RiskState current, TradeIntent intent, BigDecimal notional, Instant now) {
    if (notional == null || notional.signum() <= 0) {
      return RiskDecision.veto(RiskCode.INVALID_NOTIONAL, "Notional must be positive");
    }
    if (current.halted()) {
      return RiskDecision.veto(
          RiskCode.TRADING_HALTED, "Trading halted: " + current.haltReason());
    }
    if (current.isPaused(now)) {
      return RiskDecision.veto(
          RiskCode.TRADING_PAUSED, "Trading paused until " + current.pausedUntil());
    }
    if (current.isQuarantined(intent.whaleAddress())) {
      return RiskDecision.veto(
          RiskCode.WHALE_QUARANTINED, "Whale " + intent.whaleAddress() + " is quarantined");
    }
    if (current.blockedWhales().contains(intent.whaleAddress())) {
      return RiskDecision.veto(
          RiskCode.WHALE_DAILY_LOSS_LIMIT,
          "Whale " + intent.whaleAddress() + " exceeded its daily loss limit");
    }
    if (notional.compareTo(properties.getMaxPositionUsd()) > 0) {
      return RiskDecision.veto(
          RiskCode.POSITION_LIMIT,
          "Notional " + notional + " exceeds per-position limit " + properties.getMaxPositionUsd());
    }
    BigDecimal market = current.marketExposure(intent.tokenId()).add(notional);
    if (market.compareTo(properties.getMaxMarketExposureUsd()) > 0) {
      return RiskDecision.veto(
          RiskCode.MARKET_EXPOSURE_LIMIT,
          "Market exposure " + market + " would exceed " + properties.getMaxMarketExposureUsd());
    }
    BigDecimal whale = current.whaleExposure(intent.whaleAddress()).add(notional);
    if (whale.compareTo(properties.getMaxWhaleExposureUsd()) > 0) {
      return RiskDecision.veto(
          RiskCode.WHALE_EXPOSURE_LIMIT,
          "Whale exposure " + whale + " would exceed " + properties.getMaxWhaleExposureUsd());
    }
    BigDecimal total = current.openExposure().add(notional);
    BigDecimal allocationLimit = current.nav().multiply(properties.getMaxTotalAllocationRatio());
    if (total.compareTo(allocationLimit) > 0) {
      return RiskDecision.veto(
          RiskCode.TOTAL_ALLOCATION_LIMIT,
          "Total exposure " + total + " would exceed allocation limit " + allocationLimit);
    }
    if (current.openPositionCount() + 1 > properties.getMaxOpenPositions()) {
      return RiskDecision.veto(
          RiskCode.POSITION_COUNT_LIMIT,
          "Open position count would exceed " + properties.getMaxOpenPositions());
    }
    return RiskDecision.approve();
  }

  private BigDecimal riskMultiplier(RiskState current) {
    if (current.drawdown().compareTo(properties.getReduceDrawdownThreshold()) >= 0) {
      return properties.getReduceMultiplier();
    }
    return BigDecimal.ONE;
  }

  private static String quarantineReason(
      WhaleScoreObservation observation, BigDecimal maxScore, RiskProperties.Quarantine config) {
    if (observation.score().compareTo(config.getMinScore()) < 0) {
      return "score " + observation.score() + " below " + config.getMinScore();
    }
    if (observation.currentDrawdown() != null
        && observation.currentDrawdown().compareTo(config.getMaxDrawdown()) > 0) {
      return "drawdown " + observation.currentDrawdown() + " above " + config.getMaxDrawdown();
    }
    BigDecimal drop = maxScore.subtract(observation.score());
    if (drop.compareTo(config.getMaxScoreDrop()) >= 0) {
      return "score dropped " + drop + " points from " + maxScore;
    }
    return null;
  }

  private static boolean canRelease(
      RiskState current, WhaleScoreObservation observation, RiskProperties.Quarantine config) {
    if (observation.score().compareTo(config.getReleaseScore()) <= 0) {
      return false;
    }
    Instant lastLoss = current.whaleLastLossAt().get(observation.whaleAddress());
    if (lastLoss == null) {
      return true;
    }
    return !lastLoss.isAfter(observation.observedAt().minus(Duration.ofDays(config.getReleaseQuietDays())));
  }

  private static Map<String, Object> breakerMetadata(RiskState current) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("dailyPnl", current.dailyPnl());
    metadata.put("nav", current.nav());
    metadata.put("drawdown", current.drawdown());
    metadata.put("halted", current.halted());
    if (current.pausedUntil() != null) {
      metadata.put("pausedUntil", current.pausedUntil().toString());
    }
    return metadata;
  }

  private static LocalDate today(Instant now) {
    return LocalDate.ofInstant(now, ZoneOffset.UTC);
  }
}
