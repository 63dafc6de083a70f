package com.copytrading.engine.order;

import com.copytrading.domain.orders.OrderState;
import java.math.BigDecimal;
import java.util.Map;

/** {@code fillRate} is CONFIRMED over every order that has reached an end state or FAILED. */
public record OrderStats(Map<OrderState, Long> countsByState, BigDecimal fillRate) {
  public OrderStats {
    countsByState = Map.copyOf(countsByState);
  }
}
