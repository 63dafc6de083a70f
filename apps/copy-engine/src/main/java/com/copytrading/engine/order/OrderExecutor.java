package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.engine.position.PositionLedger;
import com.copytrading.engine.risk.RiskManager;
import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.ExchangeErrorCode;
import com.copytrading.integration.polymarket.ExchangeException;
import com.copytrading.integration.polymarket.ExchangeFillSnapshot;
import com.copytrading.integration.polymarket.ExchangeOrderAck;
import com.copytrading.integration.polymarket.ExchangeOrderRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives orders through their lifecycle against the exchange: idempotent submission with retries,
 * fills from the feed and from polling, timeouts and partial-fill resolution.
 *
 * <p>Work on one order is serialized by a striped in-process lock on top of the row lock taken by
 * {@link OrderStore}.
 */
@Service
public class OrderExecutor {
  private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

  static final String SUBMIT_TIMER = "copytrading.orders.submit.duration";
  static final String DUPLICATES_METRIC = "copytrading.orders.duplicates.total";
  private static final int LOCK_STRIPES = 64;
  private static final int SWEEP_BATCH = 100;

  private final OrderStore orderStore;
  private final OrderRepository orderRepository;
  private final OrderSettlement orderSettlement;
  private final PositionLedger positionLedger;
  private final RiskManager riskManager;
  private final ExchangeClient exchangeClient;
  private final ExchangeRetryPolicy retryPolicy;
  private final ExecutionProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final StripedLocks locks = new StripedLocks(LOCK_STRIPES);

  @Autowired
  public OrderExecutor(
      OrderStore orderStore,
      OrderRepository orderRepository,
      OrderSettlement orderSettlement,
      PositionLedger positionLedger,
      RiskManager riskManager,
      ExchangeClient exchangeClient,
      ExchangeRetryPolicy retryPolicy,
      ExecutionProperties properties,
      MeterRegistry meterRegistry) {
    this(
        orderStore,
        orderRepository,
        orderSettlement,
        positionLedger,
        riskManager,
        exchangeClient,
        retryPolicy,
        properties,
        meterRegistry,
        Clock.systemUTC());
  }

  OrderExecutor(
      OrderStore orderStore,
      OrderRepository orderRepository,
      OrderSettlement orderSettlement,
      PositionLedger positionLedger,
      RiskManager riskManager,
      ExchangeClient exchangeClient,
      ExchangeRetryPolicy retryPolicy,
      ExecutionProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.orderStore = orderStore;
    this.orderRepository = orderRepository;
    this.orderSettlement = orderSettlement;
    this.positionLedger = positionLedger;
    this.riskManager = riskManager;
    this.exchangeClient = exchangeClient;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Creates the order and sends it to the exchange. A repeated idempotency key returns the order
   * already stored under it without touching the exchange.
   */
  public Order submit(SubmitOrderCommand command) {
    Order candidate =
        Order.createNew(
            UUID.randomUUID(),
            command.idempotencyKey(),
            command.tokenId(),
            command.side(),
            command.orderType(),
            command.size(),
            command.price(),
            properties.getMaxRetries(),
            command.context(),
            clock.instant());
    Optional<Order> created = orderStore.create(candidate, "Order accepted for submission");
    if (created.isEmpty()) {
      Order existing =
          orderStore
              .findByIdempotencyKey(command.idempotencyKey())
              .orElseThrow(
                  () ->
                      new IllegalStateException(
                          "Idempotency key conflict without a stored order: "
                              + command.idempotencyKey()));
      meterRegistry.counter(DUPLICATES_METRIC).increment();
      log.info(
          "Duplicate submission ignored idempotencyKey={} orderId={} state={}",
          command.idempotencyKey(),
          existing.orderId(),
          existing.state());
      return existing;
    }
    Order order = created.get();
    return locks.withLock(order.orderId(), () -> sendToExchange(order));
  }

  /** Applies a fill from the feed; settles the order once it is completely filled. */
  public Optional<Order> onFill(FillEvent fill) {
    Order known =
        orderRepository
            .findByExchangeOrderId(fill.exchangeOrderId())
            .orElseThrow(() -> new UnknownExchangeOrderException(fill.exchangeOrderId()));
    return locks.withLock(known.orderId(), () -> applyFill(known.orderId(), fill));
  }

  /** Reconciles one open order with the exchange's view of it. */
  public void pollFills(UUID orderId) {
    locks.tryWithLock(
        orderId,
        () -> {
          Order order = orderStore.find(orderId).orElse(null);
          if (order == null || !order.state().isOpenAtExchange()) {
            return;
          }
          Optional<ExchangeFillSnapshot> snapshot = reconcileWithExchange(order);
          Order current = orderStore.find(orderId).orElseThrow();
          if (current.state() == OrderState.FILLED) {
            settleAndFinish(orderId, false, "Order filled");
          } else if (snapshot.isPresent()
              && snapshot.get().isCancelled()
              && current.state().isOpenAtExchange()) {
            resolveClosedAtExchange(orderId, "Cancelled at exchange");
          }
        });
  }

  public List<Order> openOrders() {
    return orderRepository.findByStates(
        List.of(OrderState.SUBMITTED, OrderState.PARTIALLY_FILLED), SWEEP_BATCH);
  }

  /** PENDING orders older than the pending timeout are cancelled. */
  public int expirePending() {
    Instant cutoff = clock.instant().minus(Duration.ofMillis(properties.getPendingTimeoutMs()));
    int expired = 0;
    for (Order order :
        orderRepository.findByStateUpdatedBefore(OrderState.PENDING, cutoff, SWEEP_BATCH)) {
      boolean ran =
          locks.tryWithLock(
              order.orderId(),
              () -> {
                Order cancelled =
                    orderStore.transition(
                        order.orderId(),
                        current ->
                            current.state() == OrderState.PENDING
                                    && current.updatedAt().isBefore(cutoff)
                                ? current.cancel("Pending timeout", clock.instant())
                                : current,
                        "Pending timeout",
                        Map.of("timeoutMs", properties.getPendingTimeoutMs()));
                if (cancelled.state() == OrderState.CANCELLED) {
                  onOrderFinished(cancelled);
                }
              });
      if (ran) {
        expired++;
      }
    }
    return expired;
  }

  /** Orders open at the exchange past the open-order timeout are cancelled there and resolved. */
  public int expireOpenOrders() {
    Instant cutoff = clock.instant().minus(Duration.ofMillis(properties.getOpenOrderTimeoutMs()));
    int expired = 0;
    for (Order order : orderRepository.findOpenSubmittedBefore(cutoff, SWEEP_BATCH)) {
      try {
        if (locks.tryWithLock(order.orderId(), () -> expireOpenOrder(order.orderId()))) {
          expired++;
        }
      } catch (RuntimeException ex) {
        log.error("Open order timeout handling failed orderId={}", order.orderId(), ex);
      }
    }
    return expired;
  }

  /** Settles an order recovered in FILLED state. */
  public Order settleFilled(UUID orderId) {
    return locks.withLock(orderId, () -> settleAndFinish(orderId, false, "Order filled"));
  }

  private Order sendToExchange(Order order) {
    ExchangeOrderRequest request =
        new ExchangeOrderRequest(
            order.orderId().toString(),
            order.tokenId(),
            order.side(),
            order.orderType(),
            order.size(),
            order.price());
    Timer.Sample sample = Timer.start(meterRegistry);
    int attempt = 1;
    while (true) {
      final int currentAttempt = attempt;
      try {
        ExchangeOrderAck ack = exchangeClient.submitOrder(request);
        sample.stop(submitTimer("accepted"));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exchangeOrderId", ack.exchangeOrderId());
        metadata.put("attempt", currentAttempt);
        if (ack.status() != null) {
          metadata.put("exchangeStatus", ack.status());
        }
        return orderStore.transition(
            order.orderId(),
            current -> current.markSubmitted(ack.exchangeOrderId(), clock.instant()),
            "Accepted by exchange",
            metadata);
      } catch (RuntimeException ex) {
        String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        String errorCode = errorCode(ex);
        if (!retryPolicy.isRetryable(ex)) {
          sample.stop(submitTimer("failed"));
          log.warn(
              "Order rejected by exchange orderId={} attempt={} errorCode={} error={}",
              order.orderId(),
              currentAttempt,
              errorCode,
              error);
          Order failed =
              orderStore.transition(
                  order.orderId(),
                  current -> current.fail(error, clock.instant()),
                  "Terminal exchange error",
                  Map.of("errorCode", errorCode, "attempt", currentAttempt));
          onOrderFinished(failed);
          return failed;
        }
        Order current = orderStore.find(order.orderId()).orElseThrow();
        if (!current.canRetry()) {
          sample.stop(submitTimer("dead_letter"));
          log.warn(
              "Order retries exhausted orderId={} attempts={} errorCode={} error={}",
              order.orderId(),
              currentAttempt,
              errorCode,
              error);
          orderStore.transition(
              order.orderId(),
              pending -> pending.fail(error, clock.instant()),
              "Retries exhausted",
              Map.of("errorCode", errorCode, "attempts", currentAttempt));
          Order dead =
              orderStore.transition(
                  order.orderId(),
                  failed -> failed.deadLetter(clock.instant()),
                  "Moved to dead letter",
                  Map.of("attempts", currentAttempt));
          onOrderFinished(dead);
          return dead;
        }
        Order retried = orderStore.recordRetry(order.orderId(), error);
        Duration backoff = retryPolicy.backoffForRetry(retried.retryCount());
        log.warn(
            "Order submit failed, retrying orderId={} attempt={} retry={}/{} backoffMs={} errorCode={}",
            order.orderId(),
            currentAttempt,
            retried.retryCount(),
            retried.maxRetries(),
            backoff.toMillis(),
            errorCode);
        retryPolicy.pause(backoff);
        attempt++;
      }
    }
  }

  private Optional<Order> applyFill(UUID orderId, FillEvent fill) {
    Optional<Order> updated = orderStore.recordFill(orderId, fill);
    if (updated.isPresent() && updated.get().state() == OrderState.FILLED) {
      return Optional.of(settleAndFinish(orderId, false, "Order filled"));
    }
    return updated;
  }

  private void expireOpenOrder(UUID orderId) {
    Order order = orderStore.find(orderId).orElse(null);
    if (order == null || !order.state().isOpenAtExchange()) {
      return;
    }
    try {
      retryPolicy.execute("cancel", () -> exchangeClient.cancelOrder(order.exchangeOrderId()));
    } catch (ExchangeException ex) {
      if (ex.errorCode() != ExchangeErrorCode.ORDER_NOT_FOUND) {
        log.warn(
            "Exchange cancel failed, will retry on next sweep orderId={} exchangeOrderId={} errorCode={}",
            orderId,
            order.exchangeOrderId(),
            ex.errorCode());
        return;
      }
    }
    reconcileWithExchange(order);
    resolveClosedAtExchange(orderId, "Open order timeout");
  }

  /**
   * Resolves an order the exchange no longer works: nothing filled cancels it, a fill ratio at or
   * above the accept ratio confirms it, anything less confirms the filled part and re-submits the
   * remainder as a child order.
   */
  private void resolveClosedAtExchange(UUID orderId, String reason) {
    Order order = orderStore.find(orderId).orElseThrow();
    switch (order.state()) {
      case FILLED -> settleAndFinish(orderId, false, "Order filled");
      case SUBMITTED -> {
        Order cancelled =
            orderStore.transition(
                orderId,
                current -> current.cancel(reason, clock.instant()),
                reason,
                Map.of("filledSize", BigDecimal.ZERO));
        onOrderFinished(cancelled);
      }
      case PARTIALLY_FILLED -> {
        BigDecimal ratio = order.fillRatio();
        if (ratio.compareTo(properties.getPartialFillAcceptRatio()) >= 0) {
          settleAndFinish(orderId, false, "Partial fill accepted, remainder cancelled");
        } else {
          Settlement settlement =
              orderSettlement.settle(orderId, true, "Partial fill confirmed, remainder re-submitted");
          // The child carries the root idempotency key and releases the reservation when it ends.
          if (submitRemainder(settlement).isEmpty()) {
            onOrderFinished(settlement.order());
          }
        }
      }
      default -> log.debug("Order already resolved orderId={} state={}", orderId, order.state());
    }
  }

  /** Returns the remainder child that now owns the root reservation, if one could be created. */
  private Optional<Order> submitRemainder(Settlement settlement) {
    Order parent = settlement.order();
    UUID rootOrderId = parent.rootOrderId() == null ? parent.orderId() : parent.rootOrderId();
    int childNumber = orderRepository.countChildren(rootOrderId) + 1;
    if (parent.remainingSize().signum() <= 0) {
      return Optional.empty();
    }
    Order child =
        parent.createRemainderChild(
            UUID.randomUUID(),
            childNumber,
            settlement.position() == null ? null : settlement.position().positionId(),
            clock.instant());
    Optional<Order> created = orderStore.create(child, "Remainder of partially filled order");
    if (created.isEmpty()) {
      log.info(
          "Remainder order already exists idempotencyKey={} parentOrderId={}",
          child.idempotencyKey(),
          parent.orderId());
      return orderStore.findByIdempotencyKey(child.idempotencyKey());
    }
    log.info(
        "Remainder order created orderId={} parentOrderId={} rootOrderId={} size={}",
        child.orderId(),
        parent.orderId(),
        rootOrderId,
        child.size());
    return Optional.of(locks.withLock(child.orderId(), () -> sendToExchange(created.get())));
  }

  private Order settleAndFinish(UUID orderId, boolean remainderFollows, String reason) {
    Settlement settlement = orderSettlement.settle(orderId, remainderFollows, reason);
    onOrderFinished(settlement.order());
    return settlement.order();
  }

  private Optional<ExchangeFillSnapshot> reconcileWithExchange(Order order) {
    ExchangeFillSnapshot snapshot;
    try {
      snapshot =
          retryPolicy.execute("poll", () -> exchangeClient.pollFill(order.exchangeOrderId()));
    } catch (ExchangeException ex) {
      log.warn(
          "Fill poll failed orderId={} exchangeOrderId={} errorCode={}",
          order.orderId(),
          order.exchangeOrderId(),
          ex.errorCode());
      return Optional.empty();
    }
    BigDecimal matched = snapshot.sizeMatched() == null ? BigDecimal.ZERO : snapshot.sizeMatched();
    BigDecimal delta = matched.subtract(order.filledSize());
    if (delta.signum() > 0) {
      BigDecimal price = snapshot.price() != null ? snapshot.price() : order.price();
      orderStore.recordFill(
          order.orderId(),
          new FillEvent(
              order.exchangeOrderId(),
              snapshot.tradeCount(),
              delta,
              price,
              clock.instant(),
              FillSource.POLL));
    }
    return Optional.of(snapshot);
  }

  /**
   * Side effects of an order reaching the end of its life: the risk reservation of an opening
   * order is released, and a closing order that filled nothing hands its position back to OPEN.
   * A parent whose remainder child is still working never gets here; the child releases instead.
   */
  private void onOrderFinished(Order order) {
    boolean finished = order.isTerminal() || order.state() == OrderState.FAILED;
    if (!finished) {
      return;
    }
    if (!order.context().isClosing()) {
      riskManager.releaseReservation(order.rootIdempotencyKey());
      return;
    }
    if (order.filledSize().signum() == 0 && order.state() != OrderState.CONFIRMED) {
      positionLedger.reopenAfterFailedClose(
          order.context().positionId(), "Closing order " + order.orderId() + " " + order.state());
    }
  }

  private Timer submitTimer(String outcome) {
    return Timer.builder(SUBMIT_TIMER).tag("outcome", outcome).register(meterRegistry);
  }

  private static String errorCode(RuntimeException ex) {
    if (ex instanceof ExchangeException exchangeException) {
      return exchangeException.errorCode().name();
    }
    return ex.getClass().getSimpleName();
  }
}
