package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.positions.Position;
import com.copytrading.engine.position.PositionLedger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Confirms an order by applying its filled quantity to the position ledger. The ledger write and
 * the CONFIRMED transition commit together, so a confirmed order always has its position.
 */
@Service
public class OrderSettlement {
  private final OrderStore orderStore;
  private final PositionLedger positionLedger;

  public OrderSettlement(OrderStore orderStore, PositionLedger positionLedger) {
    this.orderStore = orderStore;
    this.positionLedger = positionLedger;
  }

  /**
   * @param remainderFollows a child order will carry the unfilled rest, so a closing position stays
   *     CLOSING
   */
  @Transactional
  public Settlement settle(UUID orderId, boolean remainderFollows, String reason) {
    Order order = orderStore.lock(orderId);
    if (order.state() == OrderState.CONFIRMED) {
      return new Settlement(order, null);
    }
    if (!order.state().hasFills()) {
      throw new IllegalStateException(
          "Order " + orderId + " has no fills to settle, state " + order.state());
    }
    Position position = positionLedger.applyOrderFill(order, remainderFollows);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("positionId", position.positionId().toString());
    metadata.put("filledSize", order.filledSize());
    metadata.put("avgFillPrice", order.avgFillPrice());
    metadata.put("fillRatio", order.fillRatio());
    Order confirmed =
        orderStore.transition(
            orderId, current -> current.confirm(orderStore.now()), reason, metadata);
    return new Settlement(confirmed, position);
  }
}
