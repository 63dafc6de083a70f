package com.copytrading.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class OrderTest {
  private static final Instant NOW = Instant.parse("2026-02-24T00:00:00Z");

  @Test
  void shouldCreatePendingOrderAndWalkToConfirmed() {
    Order order = newLimitOrder(new BigDecimal("100"));

    Order submitted = order.markSubmitted("ex-1", NOW.plusSeconds(1));
    Order partial = submitted.applyFill(new BigDecimal("40"), new BigDecimal("0.50"), NOW.plusSeconds(2));
    Order filled = partial.applyFill(new BigDecimal("60"), new BigDecimal("0.60"), NOW.plusSeconds(3));
    Order confirmed = filled.confirm(NOW.plusSeconds(4));

    assertEquals(OrderState.PENDING, order.state());
    assertEquals(OrderState.SUBMITTED, submitted.state());
    assertEquals(NOW.plusSeconds(1), submitted.submittedAt());
    assertEquals(OrderState.PARTIALLY_FILLED, partial.state());
    assertEquals(0, new BigDecimal("60").compareTo(partial.remainingSize()));
    assertEquals(OrderState.FILLED, filled.state());
    assertEquals(0, new BigDecimal("0.56").compareTo(filled.avgFillPrice()));
    assertEquals(NOW.plusSeconds(3), filled.filledAt());
    assertEquals(OrderState.CONFIRMED, confirmed.state());
    assertEquals(NOW.plusSeconds(4), confirmed.confirmedAt());
    assertTrue(confirmed.isTerminal());
  }

  @Test
  void shouldRejectFillBeyondSize() {
    Order submitted = newLimitOrder(new BigDecimal("10")).markSubmitted("ex-1", NOW);

    assertThrows(
        OrderDomainException.class,
        () -> submitted.applyFill(new BigDecimal("11"), new BigDecimal("0.5"), NOW));
  }

  @Test
  void shouldRejectPriceOutsideProbabilityBounds() {
    assertThrows(
        OrderDomainException.class,
        () ->
            Order.createNew(
                UUID.randomUUID(),
                "key-1",
                "token-1",
                OrderSide.BUY,
                OrderType.LIMIT,
                BigDecimal.TEN,
                new BigDecimal("1.20"),
                3,
                openingContext(),
                NOW));
  }

  @Test
  void shouldRejectMarketOrderWithPrice() {
    assertThrows(
        OrderDomainException.class,
        () ->
            Order.createNew(
                UUID.randomUUID(),
                "key-2",
                "token-1",
                OrderSide.SELL,
                OrderType.MARKET,
                BigDecimal.ONE,
                new BigDecimal("0.40"),
                3,
                openingContext(),
                NOW));
  }

  @Test
  void shouldCountRetriesOnlyWhilePending() {
    Order order = newLimitOrder(BigDecimal.TEN);

    Order retried = order.recordRetry("timeout", NOW.plusSeconds(1)).recordRetry("503", NOW.plusSeconds(2));

    assertEquals(2, retried.retryCount());
    assertEquals("503", retried.errorMessage());
    assertTrue(retried.canRetry());
    assertThrows(
        OrderDomainException.class,
        () -> order.markSubmitted("ex-1", NOW).recordRetry("late", NOW));
  }

  @Test
  void shouldDeadLetterOnlyThroughFailed() {
    Order order = newLimitOrder(BigDecimal.TEN);

    assertThrows(OrderDomainException.class, () -> order.deadLetter(NOW));
    Order dead = order.fail("retries exhausted", NOW).deadLetter(NOW.plusSeconds(1));

    assertEquals(OrderState.DEAD_LETTER, dead.state());
    assertEquals("retries exhausted", dead.errorMessage());
  }

  @Test
  void shouldCreateRemainderChildWithLineage() {
    Order order = newLimitOrder(new BigDecimal("100"));
    Order partial =
        order
            .markSubmitted("ex-1", NOW)
            .applyFill(new BigDecimal("30"), new BigDecimal("0.55"), NOW)
            .confirm(NOW);
    UUID positionId = UUID.randomUUID();

    Order child = partial.createRemainderChild(UUID.randomUUID(), 1, positionId, NOW);
    Order grandChild =
        child
            .markSubmitted("ex-2", NOW)
            .applyFill(new BigDecimal("10"), new BigDecimal("0.55"), NOW)
            .confirm(NOW)
            .createRemainderChild(UUID.randomUUID(), 2, positionId, NOW);

    assertEquals("key-open:child:1", child.idempotencyKey());
    assertEquals(0, new BigDecimal("70").compareTo(child.size()));
    assertEquals(order.orderId(), child.parentOrderId());
    assertEquals(order.orderId(), child.rootOrderId());
    assertEquals(positionId, child.context().positionId());
    assertEquals(OrderState.PENDING, child.state());
    assertNull(child.exchangeOrderId());
    assertEquals("key-open:child:2", grandChild.idempotencyKey());
    assertEquals(order.orderId(), grandChild.rootOrderId());
    assertEquals(child.orderId(), grandChild.parentOrderId());
  }

  @Test
  void shouldRequirePositionForClosingContext() {
    assertThrows(
        OrderDomainException.class, () -> OrderContext.closing("0xA", null, "STOP_LOSS"));
  }

  private static Order newLimitOrder(BigDecimal size) {
    return Order.createNew(
        UUID.randomUUID(),
        "key-open",
        "token-1",
        OrderSide.BUY,
        OrderType.LIMIT,
        size,
        new BigDecimal("0.55"),
        Order.DEFAULT_MAX_RETRIES,
        openingContext(),
        NOW);
  }

  private static OrderContext openingContext() {
    return OrderContext.opening(
        "0xA",
        "politics",
        new BigDecimal("0.06"),
        new BigDecimal("0.07"),
        new BigDecimal("0.65"),
        new BigDecimal("0.47"),
        new BigDecimal("0.72"),
        NOW.plusSeconds(86_400));
  }
}
