package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderDomainException;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.orders.OrderTransition;
import com.copytrading.engine.audit.AuditTrail;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists order mutations. Each state change locks the row, writes the order and appends its
 * transition in one transaction.
 */
@Service
public class OrderStore {
  private static final Logger log = LoggerFactory.getLogger(OrderStore.class);
  static final String TRANSITIONS_METRIC = "copytrading.orders.transitions.total";

  private final OrderRepository orderRepository;
  private final OrderFillRepository orderFillRepository;
  private final AuditTrail auditTrail;
  private final OrderEventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public OrderStore(
      OrderRepository orderRepository,
      OrderFillRepository orderFillRepository,
      AuditTrail auditTrail,
      OrderEventPublisher eventPublisher,
      MeterRegistry meterRegistry) {
    this(
        orderRepository,
        orderFillRepository,
        auditTrail,
        eventPublisher,
        meterRegistry,
        Clock.systemUTC());
  }

  OrderStore(
      OrderRepository orderRepository,
      OrderFillRepository orderFillRepository,
      AuditTrail auditTrail,
      OrderEventPublisher eventPublisher,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.orderRepository = orderRepository;
    this.orderFillRepository = orderFillRepository;
    this.auditTrail = auditTrail;
    this.eventPublisher = eventPublisher;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public Instant now() {
    return clock.instant();
  }

  /** Empty when another order already holds the idempotency key. */
  @Transactional
  public Optional<Order> create(Order order, String reason) {
    if (!orderRepository.insertIfAbsent(order)) {
      return Optional.empty();
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("idempotencyKey", order.idempotencyKey());
    metadata.put("purpose", order.context().purpose().name());
    if (order.parentOrderId() != null) {
      metadata.put("parentOrderId", order.parentOrderId().toString());
    }
    auditTrail.recordOrderTransition(OrderTransition.of(null, order, reason, metadata));
    count(order.state());
    eventPublisher.publish(order);
    log.info(
        "Order created orderId={} idempotencyKey={} tokenId={} side={} size={} price={}",
        order.orderId(),
        order.idempotencyKey(),
        order.tokenId(),
        order.side(),
        order.size(),
        order.price());
    return Optional.of(order);
  }

  @Transactional(readOnly = true)
  public Optional<Order> find(UUID orderId) {
    return orderRepository.findById(orderId);
  }

  @Transactional(readOnly = true)
  public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
    return orderRepository.findByIdempotencyKey(idempotencyKey);
  }

  /** Locks the row for the rest of the caller's transaction. */
  @Transactional
  public Order lock(UUID orderId) {
    return orderRepository
        .findByIdForUpdate(orderId)
        .orElseThrow(() -> new OrderDomainException("Order not found: " + orderId));
  }

  /** Applies a state-changing mutation and records the transition. */
  @Transactional
  public Order transition(
      UUID orderId, UnaryOperator<Order> mutation, String reason, Map<String, Object> metadata) {
    Order before = lock(orderId);
    Order after = mutation.apply(before);
    orderRepository.update(after);
    if (after.state() != before.state()) {
      auditTrail.recordOrderTransition(OrderTransition.of(before, after, reason, metadata));
      count(after.state());
      log.info(
          "Order transition orderId={} from={} to={} reason={}",
          orderId,
          before.state(),
          after.state(),
          reason);
    }
    eventPublisher.publish(after);
    return after;
  }

  /** Persists a failed submission attempt; the order stays PENDING. */
  @Transactional
  public Order recordRetry(UUID orderId, String error) {
    Order before = lock(orderId);
    Order after = before.recordRetry(error, clock.instant());
    orderRepository.update(after);
    return after;
  }

  /**
   * Applies one fill to an order open at the exchange. Empty for duplicates, unknown exchange ids
   * and orders no longer accepting fills.
   */
  @Transactional
  public Optional<Order> recordFill(UUID orderId, FillEvent fill) {
    Order before = lock(orderId);
    if (!before.state().isOpenAtExchange()) {
      log.debug(
          "Ignoring fill for order not open at exchange orderId={} state={} sequence={}",
          orderId,
          before.state(),
          fill.sequence());
      return Optional.empty();
    }
    if (!orderFillRepository.insertIfAbsent(orderId, fill, clock.instant())) {
      log.debug(
          "Duplicate fill ignored orderId={} sequence={} source={}",
          orderId,
          fill.sequence(),
          fill.source());
      return Optional.empty();
    }
    BigDecimal size = fill.size().min(before.remainingSize());
    if (size.compareTo(fill.size()) < 0) {
      log.warn(
          "Fill larger than remaining size orderId={} fillSize={} remaining={}",
          orderId,
          fill.size(),
          before.remainingSize());
    }
    if (size.signum() <= 0) {
      return Optional.empty();
    }
    Order after = before.applyFill(size, fill.price(), clock.instant());
    orderRepository.update(after);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("fillSequence", fill.sequence());
    metadata.put("fillSize", size);
    metadata.put("fillPrice", fill.price());
    metadata.put("source", fill.source().name());
    auditTrail.recordOrderTransition(OrderTransition.of(before, after, "Fill received", metadata));
    if (after.state() != before.state()) {
      count(after.state());
    }
    log.info(
        "Fill applied orderId={} sequence={} size={} price={} filled={}/{} state={}",
        orderId,
        fill.sequence(),
        size,
        fill.price(),
        after.filledSize(),
        after.size(),
        after.state());
    eventPublisher.publish(after);
    return Optional.of(after);
  }

  private void count(OrderState state) {
    meterRegistry.counter(TRANSITIONS_METRIC, "to", state.name()).increment();
  }
}
