package com.copytrading.engine.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrading.engine.audit.AuditTrail;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RiskManagerTest {
  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

  private RiskProperties properties;
  private RiskStateRepository repository;
  private AuditTrail auditTrail;
  private SimpleMeterRegistry meterRegistry;
  private Clock clock;
  private RiskManager riskManager;

  @BeforeEach
  void setUp() {
    properties = new RiskProperties();
    repository = mock(RiskStateRepository.class);
    when(repository.load()).thenReturn(Optional.empty());
    auditTrail = mock(AuditTrail.class);
    meterRegistry = new SimpleMeterRegistry();
    clock = mock(Clock.class);
    when(clock.instant()).thenReturn(START);
    riskManager = new RiskManager(properties, repository, auditTrail, meterRegistry, clock);
  }

  @Test
  void approvalReservesNotionalUntilReleased() {
    RiskDecision decision = riskManager.approve(intent("k1", "0xA", "M1"), new BigDecimal("500"));

    assertTrue(decision.approved());
    assertEquals(RiskCode.APPROVED, decision.code());
    assertEquals(0, riskManager.snapshot().openExposure().compareTo(new BigDecimal("500")));
    assertEquals(1, riskManager.snapshot().openPositionCount());

    riskManager.releaseReservation("k1");

    assertEquals(0, riskManager.snapshot().openExposure().signum());
    assertEquals(0, riskManager.snapshot().openPositionCount());
  }

  @Test
  void previewDoesNotReserve() {
    assertTrue(riskManager.preview(intent("preview", "0xA", "M1"), new BigDecimal("500")).approved());
    assertEquals(0, riskManager.snapshot().openPositionCount());
  }

  @Test
  void limitChecksVetoWithSpecificCodes() {
    assertEquals(
        RiskCode.INVALID_NOTIONAL,
        riskManager.approve(intent("k0", "0xA", "M1"), BigDecimal.ZERO).code());
    assertEquals(
        RiskCode.POSITION_LIMIT,
        riskManager.approve(intent("k1", "0xA", "M1"), new BigDecimal("1000.01")).code());

    riskManager.syncPosition(
        new PositionExposure(
            UUID.randomUUID(), "0xB", "M1", "politics", new BigDecimal("4800"), BigDecimal.ZERO));
    assertEquals(
        RiskCode.MARKET_EXPOSURE_LIMIT,
        riskManager.approve(intent("k2", "0xA", "M1"), new BigDecimal("300")).code());

    properties.setMaxOpenPositions(2);
    assertTrue(riskManager.approve(intent("k3", "0xA", "M2"), new BigDecimal("100")).approved());
    assertEquals(
        RiskCode.POSITION_COUNT_LIMIT,
        riskManager.approve(intent("k4", "0xA", "M3"), new BigDecimal("100")).code());
    assertEquals(
        1.0,
        meterRegistry
            .counter(
                RiskManager.DECISIONS_METRIC, "outcome", "vetoed", "code", "POSITION_COUNT_LIMIT")
            .count());
  }

  @Test
  void dailyLossHaltsUntilOperatorReset() {
    riskManager.recordRealizedPnl("0xA", new BigDecimal("-500"));

    RiskState halted = riskManager.snapshot();
    assertTrue(halted.halted());
    assertEquals(RiskManager.HALT_DAILY_LOSS, halted.haltReason());
    assertTrue(halted.blockedWhales().contains("0xA"));
    assertEquals(0, halted.nav().compareTo(new BigDecimal("9500")));
    assertEquals(
        RiskCode.TRADING_HALTED,
        riskManager.approve(intent("k1", "0xB", "M1"), new BigDecimal("100")).code());
    assertEquals(
        1.0, meterRegistry.counter(RiskManager.BREAKER_METRIC, "tier", "HALT").count());

    RiskState reset = riskManager.resetCircuitBreaker("ops@example.com");

    assertFalse(reset.halted());
    assertNull(reset.haltReason());
    riskManager.syncPosition(
        new PositionExposure(
            UUID.randomUUID(), "0xB", "M2", "politics", new BigDecimal("100"), BigDecimal.ZERO));
    assertFalse(riskManager.snapshot().halted());
    assertTrue(riskManager.approve(intent("k2", "0xB", "M1"), new BigDecimal("100")).approved());
    assertEquals(
        RiskCode.WHALE_DAILY_LOSS_LIMIT,
        riskManager.approve(intent("k3", "0xA", "M1"), new BigDecimal("100")).code());
    verify(auditTrail)
        .recordEvent(
            eq("ops@example.com"),
            eq("CIRCUIT_BREAKER_RESET"),
            eq(AuditTrail.ENTITY_RISK),
            eq("circuit-breaker"),
            anyMap(),
            anyMap(),
            anyMap());
  }

  @Test
  void whaleDailyLossHaltsTradingForTheDay() {
    riskManager.recordRealizedPnl("0xA", new BigDecimal("-250"));

    RiskState halted = riskManager.snapshot();
    assertTrue(halted.halted());
    assertEquals(RiskManager.HALT_WHALE_LOSS, halted.haltReason());
    assertTrue(halted.blockedWhales().contains("0xA"));
    assertEquals(
        RiskCode.TRADING_HALTED,
        riskManager.approve(intent("k1", "0xB", "M1"), new BigDecimal("100")).code());
    assertEquals(
        1.0, meterRegistry.counter(RiskManager.BREAKER_METRIC, "tier", "HALT").count());
    assertEquals(
        1.0, meterRegistry.counter(RiskManager.BREAKER_METRIC, "tier", "WHALE_BLOCK").count());

    when(clock.instant()).thenReturn(START.plus(Duration.ofDays(1)));
    assertTrue(riskManager.rollTradingDay());
    assertFalse(riskManager.snapshot().halted());
    assertTrue(riskManager.approve(intent("k2", "0xA", "M1"), new BigDecimal("100")).approved());
  }

  @Test
  void breakerStateIsSavedAndRestoredAcrossInstances() {
    riskManager.observeWhaleScore(
        new WhaleScoreObservation("0xQ", new BigDecimal("40"), null, START));
    riskManager.recordRealizedPnl("0xA", new BigDecimal("-600"));

    ArgumentCaptor<PersistedRiskState> saved = ArgumentCaptor.forClass(PersistedRiskState.class);
    verify(repository, atLeastOnce()).save(saved.capture(), eq(START));
    PersistedRiskState latest = saved.getValue();
    assertTrue(latest.halted());
    assertEquals(0, latest.realizedPnlToday().compareTo(new BigDecimal("-600")));

    RiskStateRepository restartedRepository = mock(RiskStateRepository.class);
    when(restartedRepository.load()).thenReturn(Optional.of(latest));
    RiskManager restarted =
        new RiskManager(properties, restartedRepository, auditTrail, meterRegistry, clock);
    PositionExposure open =
        new PositionExposure(
            UUID.randomUUID(), "0xB", "M2", "politics", new BigDecimal("100"), BigDecimal.ZERO);

    RiskState restored = restarted.restore(List.of(open));

    assertTrue(restored.halted());
    assertEquals(RiskManager.HALT_DAILY_LOSS, restored.haltReason());
    assertEquals(0, restored.nav().compareTo(new BigDecimal("9400")));
    assertEquals(1, restored.positions().size());
    assertTrue(restarted.isQuarantined("0xQ"));
    assertEquals(
        RiskCode.TRADING_HALTED,
        restarted.approve(intent("k1", "0xB", "M1"), new BigDecimal("100")).code());
    verify(restartedRepository, never()).save(any(), any());
  }

  @Test
  void restoreWithoutSnapshotStartsFromConfiguredNav() {
    RiskState restored = riskManager.restore(List.of());

    assertFalse(restored.halted());
    assertEquals(0, restored.nav().compareTo(properties.getStartingNav()));
  }

  @Test
  void newTradingDayClearsDailyCounters() {
    riskManager.recordRealizedPnl("0xA", new BigDecimal("-500"));
    when(clock.instant()).thenReturn(START.plus(Duration.ofDays(1)));

    assertTrue(riskManager.rollTradingDay());

    RiskState state = riskManager.snapshot();
    assertEquals(LocalDate.of(2026, 3, 2), state.tradingDay());
    assertFalse(state.halted());
    assertTrue(state.blockedWhales().isEmpty());
    assertEquals(0, state.dailyPnl().signum());
    assertEquals(0, state.realizedPnlTotal().compareTo(new BigDecimal("-500")));
    assertFalse(riskManager.rollTradingDay());
  }

  @Test
  void consecutiveLossesPauseTrading() {
    for (int i = 0; i < 5; i++) {
      riskManager.recordPositionClosed(UUID.randomUUID(), "0xA", new BigDecimal("-1"));
    }

    RiskState paused = riskManager.snapshot();
    assertEquals(START.plus(Duration.ofMinutes(60)), paused.pausedUntil());
    assertEquals(0, paused.consecutiveLosses());
    assertEquals(
        RiskCode.TRADING_PAUSED,
        riskManager.approve(intent("k1", "0xB", "M1"), new BigDecimal("100")).code());

    when(clock.instant()).thenReturn(START.plus(Duration.ofMinutes(61)));
    assertTrue(riskManager.approve(intent("k2", "0xB", "M1"), new BigDecimal("100")).approved());
  }

  @Test
  void winResetsLossStreak() {
    riskManager.recordPositionClosed(UUID.randomUUID(), "0xA", new BigDecimal("-1"));
    riskManager.recordPositionClosed(UUID.randomUUID(), "0xA", new BigDecimal("-1"));
    riskManager.recordPositionClosed(UUID.randomUUID(), "0xA", new BigDecimal("3"));

    assertEquals(0, riskManager.snapshot().consecutiveLosses());
  }

  @Test
  void drawdownHalvesTheRiskMultiplier() {
    assertEquals(0, riskManager.riskMultiplier().compareTo(BigDecimal.ONE));

    riskManager.syncPosition(
        new PositionExposure(
            UUID.randomUUID(), "0xA", "M1", "politics", new BigDecimal("800"), new BigDecimal("-1000")));

    assertEquals(0, riskManager.snapshot().drawdown().compareTo(new BigDecimal("0.10")));
    assertEquals(0, riskManager.riskMultiplier().compareTo(new BigDecimal("0.5")));
  }

  @Test
  void lowScoreQuarantinesAndRecoveryReleases() {
    QuarantineChange entered =
        riskManager.observeWhaleScore(
            new WhaleScoreObservation("0xA", new BigDecimal("45"), new BigDecimal("0.05"), START));

    assertEquals(QuarantineChange.ENTERED, entered);
    assertTrue(riskManager.isQuarantined("0xA"));
    assertEquals(
        RiskCode.WHALE_QUARANTINED,
        riskManager.approve(intent("k1", "0xA", "M1"), new BigDecimal("100")).code());

    QuarantineChange released =
        riskManager.observeWhaleScore(
            new WhaleScoreObservation(
                "0xA", new BigDecimal("65"), new BigDecimal("0.05"), START.plus(Duration.ofDays(1))));

    assertEquals(QuarantineChange.RELEASED, released);
    assertFalse(riskManager.isQuarantined("0xA"));
    verify(auditTrail)
        .recordEvent(
            eq("risk-manager"),
            eq("WHALE_QUARANTINED"),
            eq(AuditTrail.ENTITY_WHALE),
            eq("0xA"),
            any(),
            any(),
            anyMap());
  }

  @Test
  void sharpScoreDropQuarantines() {
    riskManager.observeWhaleScore(
        new WhaleScoreObservation("0xA", new BigDecimal("90"), new BigDecimal("0.02"), START));

    QuarantineChange change =
        riskManager.observeWhaleScore(
            new WhaleScoreObservation(
                "0xA", new BigDecimal("64"), new BigDecimal("0.02"), START.plus(Duration.ofDays(2))));

    assertEquals(QuarantineChange.ENTERED, change);
    assertTrue(riskManager.snapshot().quarantinedWhales().get("0xA").reason().contains("dropped"));
  }

  @Test
  void recentLossKeepsWhaleQuarantined() {
    riskManager.observeWhaleScore(
        new WhaleScoreObservation("0xA", new BigDecimal("45"), null, START));
    riskManager.recordPositionClosed(UUID.randomUUID(), "0xA", new BigDecimal("-5"));

    QuarantineChange change =
        riskManager.observeWhaleScore(
            new WhaleScoreObservation(
                "0xA", new BigDecimal("70"), null, START.plus(Duration.ofDays(1))));

    assertEquals(QuarantineChange.UNCHANGED, change);
    assertTrue(riskManager.isQuarantined("0xA"));
  }

  private static TradeIntent intent(String key, String whale, String token) {
    return new TradeIntent(key, whale, token, "politics");
  }
}
