package com.copytrading.engine.position;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderType;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.engine.order.ExecutionProperties;
import com.copytrading.engine.order.OrderExecutor;
import com.copytrading.engine.order.SubmitOrderCommand;
import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.ExchangeErrorCode;
import com.copytrading.integration.polymarket.ExchangeException;
import com.copytrading.integration.polymarket.OrderBook;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ExitCoordinatorTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private PositionLedger positionLedger;
  private PositionRepository positionRepository;
  private OrderExecutor orderExecutor;
  private SimpleMeterRegistry meterRegistry;
  private ExitCoordinator coordinator;

  @BeforeEach
  void setUp() {
    positionLedger = mock(PositionLedger.class);
    positionRepository = mock(PositionRepository.class);
    orderExecutor = mock(OrderExecutor.class);
    ExchangeClient exchangeClient = mock(ExchangeClient.class);
    when(exchangeClient.fetchOrderBook(anyString()))
        .thenReturn(new OrderBook("M1", List.of(), List.of()));
    meterRegistry = new SimpleMeterRegistry();
    coordinator =
        new ExitCoordinator(
            positionLedger,
            positionRepository,
            orderExecutor,
            exchangeClient,
            new ExecutionProperties(),
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void failedCloseDoesNotStrandTheRestOfTheTick() {
    Position first = closing("0xA");
    Position second = closing("0xB");
    when(positionLedger.onPriceTick("M1", new BigDecimal("0.40")))
        .thenReturn(
            List.of(
                new ExitDecision(first, ExitTrigger.STOP_LOSS, new BigDecimal("0.40")),
                new ExitDecision(second, ExitTrigger.STOP_LOSS, new BigDecimal("0.40"))));
    when(orderExecutor.submit(any()))
        .thenThrow(new ExchangeException(ExchangeErrorCode.SERVER_ERROR, "502"))
        .thenReturn(closingOrder());

    List<ExitDecision> exits = coordinator.onPriceTick("M1", new BigDecimal("0.40"));

    assertEquals(2, exits.size());
    ArgumentCaptor<SubmitOrderCommand> commands = ArgumentCaptor.forClass(SubmitOrderCommand.class);
    verify(orderExecutor, times(2)).submit(commands.capture());
    assertEquals(
        second.positionId(), commands.getAllValues().get(1).context().positionId());
    verify(positionLedger).reopenAfterFailedClose(eq(first.positionId()), anyString());
    verify(positionLedger, never()).reopenAfterFailedClose(eq(second.positionId()), anyString());
    assertEquals(
        1.0,
        meterRegistry
            .counter(ExitCoordinator.EXIT_FAILURES_METRIC, "trigger", "STOP_LOSS")
            .count());
  }

  @Test
  void liquidationCountsOnlySubmittedCloses() {
    Position first = open("0xA");
    Position second = open("0xA");
    when(positionRepository.findActiveByWhale("0xA")).thenReturn(List.of(first, second));
    when(positionLedger.markClosing(eq(first.positionId()), anyString(), anyString()))
        .thenReturn(Optional.of(first.markClosing(NOW)));
    when(positionLedger.markClosing(eq(second.positionId()), anyString(), anyString()))
        .thenReturn(Optional.of(second.markClosing(NOW)));
    when(orderExecutor.submit(any()))
        .thenThrow(new IllegalStateException("store unavailable"))
        .thenReturn(closingOrder());

    assertEquals(1, coordinator.liquidateWhale("0xA"));

    verify(orderExecutor, times(2)).submit(any());
    verify(positionLedger).reopenAfterFailedClose(eq(first.positionId()), anyString());
  }

  @Test
  void manualCloseFailureReachesTheCaller() {
    Position position = open("0xA");
    when(positionLedger.markClosing(eq(position.positionId()), anyString(), eq("ops")))
        .thenReturn(Optional.of(position.markClosing(NOW)));
    when(orderExecutor.submit(any()))
        .thenThrow(new ExchangeException(ExchangeErrorCode.SERVER_ERROR, "502"));

    assertThrows(ExchangeException.class, () -> coordinator.closeManually(position.positionId(), "ops"));

    verify(positionLedger).reopenAfterFailedClose(eq(position.positionId()), anyString());
  }

  private static Order closingOrder() {
    return Order.createNew(
        UUID.randomUUID(),
        "close-" + UUID.randomUUID(),
        "M1",
        OrderSide.SELL,
        OrderType.LIMIT,
        new BigDecimal("900"),
        new BigDecimal("0.40"),
        3,
        OrderContext.closing("0xB", UUID.randomUUID(), "STOP_LOSS"),
        NOW);
  }

  private static Position closing(String whale) {
    return open(whale).markClosing(NOW);
  }

  private static Position open(String whale) {
    return Position.open(
        UUID.randomUUID(),
        whale,
        "M1",
        "politics",
        PositionSide.YES,
        new BigDecimal("900"),
        new BigDecimal("0.55"),
        new BigDecimal("0.4675"),
        new BigDecimal("0.715"),
        new BigDecimal("0.0512"),
        new BigDecimal("0.049"),
        new BigDecimal("0.62"),
        NOW.plus(Duration.ofDays(30)),
        NOW);
  }
}
