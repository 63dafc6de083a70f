package com.copytrading.engine.position;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.positions.CloseReason;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionDomainException;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.engine.order.ExecutionProperties;
import com.copytrading.engine.order.OrderExecutor;
import com.copytrading.engine.order.SubmitOrderCommand;
import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.ExchangeException;
import com.copytrading.integration.polymarket.OrderBook;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns exit decisions into closing orders. The position is moved to CLOSING first, so a second
 * trigger for the same position never produces a second closing order.
 */
@Service
public class ExitCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ExitCoordinator.class);
  static final String EXITS_METRIC = "copytrading.exits.triggered.total";
  static final String EXIT_FAILURES_METRIC = "copytrading.exits.failed.total";
  private static final String SYSTEM_ACTOR = "copy-engine";

  private final PositionLedger positionLedger;
  private final PositionRepository positionRepository;
  private final OrderExecutor orderExecutor;
  private final ExchangeClient exchangeClient;
  private final ExecutionProperties executionProperties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public ExitCoordinator(
      PositionLedger positionLedger,
      PositionRepository positionRepository,
      OrderExecutor orderExecutor,
      ExchangeClient exchangeClient,
      ExecutionProperties executionProperties,
      MeterRegistry meterRegistry) {
    this(
        positionLedger,
        positionRepository,
        orderExecutor,
        exchangeClient,
        executionProperties,
        meterRegistry,
        Clock.systemUTC());
  }

  ExitCoordinator(
      PositionLedger positionLedger,
      PositionRepository positionRepository,
      OrderExecutor orderExecutor,
      ExchangeClient exchangeClient,
      ExecutionProperties executionProperties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.positionLedger = positionLedger;
    this.positionRepository = positionRepository;
    this.orderExecutor = orderExecutor;
    this.exchangeClient = exchangeClient;
    this.executionProperties = executionProperties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Marks positions on the token and submits a closing order for each exit the tick triggers. */
  public List<ExitDecision> onPriceTick(String tokenId, BigDecimal price) {
    List<ExitDecision> exits = positionLedger.onPriceTick(tokenId, price);
    for (ExitDecision exit : exits) {
      log.info(
          "Exit triggered positionId={} trigger={} price={}",
          exit.position().positionId(),
          exit.trigger(),
          exit.triggerPrice());
      trySubmitClose(exit.position(), exit.trigger().closeReason(), exit.trigger().name());
    }
    return exits;
  }

  /** The copied whale traded against its own position on this token; follow it out. */
  public int onWhaleExit(String whaleAddress, String tokenId) {
    int submitted = 0;
    for (Position position : positionRepository.findActiveByWhaleAndToken(whaleAddress, tokenId)) {
      Optional<Position> closing =
          positionLedger.markClosing(
              position.positionId(), ExitTrigger.WHALE_EXIT.name(), SYSTEM_ACTOR);
      if (closing.isPresent()
          && trySubmitClose(closing.get(), CloseReason.WHALE_EXIT, ExitTrigger.WHALE_EXIT.name())) {
        submitted++;
      }
    }
    return submitted;
  }

  /** Closes every OPEN position copied from the whale. Returns the number of closing orders. */
  public int liquidateWhale(String whaleAddress) {
    int submitted = 0;
    for (Position position : positionRepository.findActiveByWhale(whaleAddress)) {
      Optional<Position> closing =
          positionLedger.markClosing(position.positionId(), "QUARANTINE", SYSTEM_ACTOR);
      if (closing.isPresent() && trySubmitClose(closing.get(), CloseReason.MANUAL, "QUARANTINE")) {
        submitted++;
      }
    }
    return submitted;
  }

  /** Operator-initiated close. Only an OPEN position can be closed this way. */
  public Order closeManually(UUID positionId, String actor) {
    Position closing =
        positionLedger
            .markClosing(positionId, CloseReason.MANUAL.name(), actor)
            .orElseThrow(
                () -> new PositionDomainException("Position " + positionId + " is not OPEN"));
    return submitClose(closing, CloseReason.MANUAL, CloseReason.MANUAL.name());
  }

  /**
   * Batch variant of {@link #submitClose}: a failed close has already reopened its position, so
   * the remaining exits in the batch still go out.
   */
  private boolean trySubmitClose(Position position, CloseReason reason, String trigger) {
    try {
      submitClose(position, reason, trigger);
      return true;
    } catch (RuntimeException ex) {
      meterRegistry.counter(EXIT_FAILURES_METRIC, "trigger", trigger).increment();
      return false;
    }
  }

  private Order submitClose(Position position, CloseReason reason, String trigger) {
    meterRegistry.counter(EXITS_METRIC, "trigger", trigger).increment();
    try {
      OrderSide side = position.side() == PositionSide.YES ? OrderSide.SELL : OrderSide.BUY;
      BigDecimal price = closingPrice(position, side);
      String idempotencyKey = "close-" + position.positionId() + "-" + clock.millis();
      SubmitOrderCommand command =
          new SubmitOrderCommand(
              idempotencyKey,
              position.tokenId(),
              side,
              executionProperties.getOrderType(),
              position.currentSize(),
              price,
              OrderContext.closing(position.whaleAddress(), position.positionId(), reason.name()));
      return orderExecutor.submit(command);
    } catch (RuntimeException ex) {
      log.error(
          "Closing order submission failed positionId={} trigger={}",
          position.positionId(),
          trigger,
          ex);
      positionLedger.reopenAfterFailedClose(position.positionId(), ex.getMessage());
      throw ex;
    }
  }

  /** Best bid when selling, best ask when buying back; the last mark when the book is empty. */
  private BigDecimal closingPrice(Position position, OrderSide side) {
    try {
      OrderBook book = exchangeClient.fetchOrderBook(position.tokenId());
      Optional<BigDecimal> touch = side == OrderSide.SELL ? book.bestBid() : book.bestAsk();
      return touch
          .map(price -> price.max(Position.MIN_PRICE).min(Position.MAX_PRICE))
          .orElse(position.currentPrice());
    } catch (ExchangeException ex) {
      log.warn(
          "Order book unavailable for closing price, using last mark positionId={} error={}",
          position.positionId(),
          ex.getMessage());
      return position.currentPrice();
    }
  }
}
