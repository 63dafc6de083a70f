package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.orders.OrderTransition;
import com.copytrading.engine.audit.AuditTrail;
import com.copytrading.engine.audit.OrderTransitionRepository;
import com.copytrading.engine.risk.ExposureEntry;
import com.copytrading.engine.risk.RiskManager;
import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Startup repair: every non-terminal order's state is re-derived from its latest transition, open
 * copy orders get their risk reservation back, and orders that were FILLED but never confirmed are
 * settled.
 */
@Service
public class OrderRecoveryService {
  private static final Logger log = LoggerFactory.getLogger(OrderRecoveryService.class);
  private static final String ACTOR = "order-recovery";
  private static final int RECOVERY_BATCH = 1000;

  private final OrderRepository orderRepository;
  private final OrderTransitionRepository transitionRepository;
  private final OrderExecutor orderExecutor;
  private final RiskManager riskManager;
  private final AuditTrail auditTrail;
  private final Clock clock;

  @Autowired
  public OrderRecoveryService(
      OrderRepository orderRepository,
      OrderTransitionRepository transitionRepository,
      OrderExecutor orderExecutor,
      RiskManager riskManager,
      AuditTrail auditTrail) {
    this(
        orderRepository,
        transitionRepository,
        orderExecutor,
        riskManager,
        auditTrail,
        Clock.systemUTC());
  }

  OrderRecoveryService(
      OrderRepository orderRepository,
      OrderTransitionRepository transitionRepository,
      OrderExecutor orderExecutor,
      RiskManager riskManager,
      AuditTrail auditTrail,
      Clock clock) {
    this.orderRepository = orderRepository;
    this.transitionRepository = transitionRepository;
    this.orderExecutor = orderExecutor;
    this.riskManager = riskManager;
    this.auditTrail = auditTrail;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  @org.springframework.core.annotation.Order(2)
  public void recoverAtStartup() {
    RecoverySummary summary = recover();
    log.info(
        "Order recovery finished scanned={} repaired={} reserved={} settled={}",
        summary.scanned(),
        summary.repaired(),
        summary.reserved(),
        summary.settled());
  }

  public RecoverySummary recover() {
    List<Order> open =
        orderRepository.findByStates(
            EnumSet.of(
                OrderState.PENDING,
                OrderState.SUBMITTED,
                OrderState.PARTIALLY_FILLED,
                OrderState.FILLED,
                OrderState.FAILED),
            RECOVERY_BATCH);
    int repaired = 0;
    int reserved = 0;
    int settled = 0;
    for (Order order : open) {
      OrderState state = order.state();
      Optional<OrderTransition> latest = transitionRepository.findLatestByOrderId(order.orderId());
      if (latest.isPresent() && latest.get().toState() != state) {
        state = latest.get().toState();
        orderRepository.forceState(order.orderId(), state, clock.instant());
        repaired++;
        log.warn(
            "Order state repaired from transition log orderId={} stored={} derived={}",
            order.orderId(),
            order.state(),
            state);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("storedState", order.state().name());
        metadata.put("derivedState", state.name());
        auditTrail.recordEvent(
            ACTOR,
            "ORDER_STATE_REPAIRED",
            AuditTrail.ENTITY_ORDER,
            order.orderId().toString(),
            Map.of("state", order.state().name()),
            Map.of("state", state.name()),
            metadata);
      }
      if (holdsReservation(order, state)) {
        riskManager.restoreReservation(
            order.rootIdempotencyKey(),
            new ExposureEntry(
                order.context().whaleAddress(),
                order.tokenId(),
                order.context().category(),
                order.size().multiply(order.price())));
        reserved++;
      }
      if (state == OrderState.FILLED) {
        try {
          orderExecutor.settleFilled(order.orderId());
          settled++;
        } catch (RuntimeException ex) {
          log.error("Settlement of recovered order failed orderId={}", order.orderId(), ex);
        }
      }
    }
    return new RecoverySummary(open.size(), repaired, reserved, settled);
  }

  private static boolean holdsReservation(Order order, OrderState state) {
    return !order.context().isClosing()
        && order.price() != null
        && (state.isOpenAtExchange() || state == OrderState.PENDING || state == OrderState.FILLED);
  }

  public record RecoverySummary(int scanned, int repaired, int reserved, int settled) {}
}
