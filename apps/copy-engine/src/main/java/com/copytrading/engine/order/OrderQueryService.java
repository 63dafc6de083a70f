package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.orders.OrderTransition;
import com.copytrading.engine.audit.AuditTrail;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class OrderQueryService {
  private static final int MAX_PAGE_SIZE = 500;

  private final OrderRepository orderRepository;
  private final AuditTrail auditTrail;

  public OrderQueryService(OrderRepository orderRepository, AuditTrail auditTrail) {
    this.orderRepository = orderRepository;
    this.auditTrail = auditTrail;
  }

  public Optional<Order> find(UUID orderId) {
    return orderRepository.findById(orderId);
  }

  public List<OrderTransition> history(UUID orderId) {
    return auditTrail.orderHistory(orderId);
  }

  public List<Order> byState(OrderState state, int offset, int limit) {
    return orderRepository.findByState(
        state, Math.max(0, offset), Math.min(Math.max(1, limit), MAX_PAGE_SIZE));
  }

  public long countByState(OrderState state) {
    return orderRepository.countByState(state);
  }

  public OrderStats stats() {
    Map<OrderState, Long> counts = new EnumMap<>(OrderState.class);
    for (OrderState state : OrderState.values()) {
      counts.put(state, orderRepository.countByState(state));
    }
    long confirmed = counts.get(OrderState.CONFIRMED);
    long finished =
        confirmed
            + counts.get(OrderState.CANCELLED)
            + counts.get(OrderState.FAILED)
            + counts.get(OrderState.DEAD_LETTER);
    BigDecimal fillRate =
        finished == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(confirmed)
                .divide(BigDecimal.valueOf(finished), 4, RoundingMode.HALF_UP);
    return new OrderStats(counts, fillRate);
  }
}
