package com.copytrading.engine.audit;

import com.copytrading.domain.orders.OrderTransition;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OrderTransitionRepository {
  void append(OrderTransition transition);

  List<OrderTransition> findByOrderId(UUID orderId);

  Optional<OrderTransition> findLatestByOrderId(UUID orderId);
}
