package com.copytrading.engine.signal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.copytrading.domain.orders.OrderSide;
import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.WhaleTradeDetectedV1;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class WhaleTradeConsumerTest {
  private static final Instant OCCURRED_AT = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void shouldMapPayloadToSignal() {
    Instant tradedAt = Instant.parse("2026-03-01T11:59:30Z");
    WhaleTradeDetectedV1 payload = payload("buy", new BigDecimal("0.62"), tradedAt);

    WhaleSignal signal = WhaleTradeConsumer.toSignal(payload, envelope(payload));

    assertEquals("t-1", signal.tradeId());
    assertEquals(OrderSide.BUY, signal.side());
    assertEquals(new BigDecimal("0.62"), signal.metrics().winRate());
    assertEquals(new BigDecimal("82"), signal.metrics().score());
    assertEquals(tradedAt, signal.tradedAt());
  }

  @Test
  void shouldFallBackToEnvelopeTimeAndKeepMissingMetricsNull() {
    WhaleTradeDetectedV1 payload = payload("SELL", null, null);

    WhaleSignal signal = WhaleTradeConsumer.toSignal(payload, envelope(payload));

    assertEquals(OrderSide.SELL, signal.side());
    assertEquals(OCCURRED_AT, signal.tradedAt());
    assertNull(signal.metrics().winRate());
  }

  @Test
  void shouldRejectMissingOrUnknownSide() {
    WhaleTradeDetectedV1 noSide = payload(null, null, null);
    WhaleTradeDetectedV1 badSide = payload("HOLD", null, null);

    assertThrows(
        IllegalArgumentException.class,
        () -> WhaleTradeConsumer.toSignal(noSide, envelope(noSide)));
    assertThrows(
        IllegalArgumentException.class,
        () -> WhaleTradeConsumer.toSignal(badSide, envelope(badSide)));
  }

  private static WhaleTradeDetectedV1 payload(String side, BigDecimal winRate, Instant tradedAt) {
    return new WhaleTradeDetectedV1(
        "t-1",
        "0xA",
        "token-yes",
        "M1",
        "politics",
        side,
        new BigDecimal("2000"),
        new BigDecimal("0.55"),
        new BigDecimal("0.55"),
        Instant.parse("2026-04-01T00:00:00Z"),
        new BigDecimal("82"),
        new BigDecimal("1.4"),
        new BigDecimal("1.2"),
        new BigDecimal("0.05"),
        winRate,
        tradedAt);
  }

  private static EventEnvelope<WhaleTradeDetectedV1> envelope(WhaleTradeDetectedV1 payload) {
    return EventEnvelope.of(
        EventTypes.WHALE_TRADE_DETECTED, 1, "whale-scorer", "corr-1", "0xA", OCCURRED_AT, payload);
  }
}
