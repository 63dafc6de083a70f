package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OrderRepository {
  /** Inserts unless the idempotency key is already taken; returns whether a row was inserted. */
  boolean insertIfAbsent(Order order);

  Optional<Order> findById(UUID orderId);

  Optional<Order> findByIdForUpdate(UUID orderId);

  Optional<Order> findByIdempotencyKey(String idempotencyKey);

  Optional<Order> findByExchangeOrderId(String exchangeOrderId);

  void update(Order order);

  List<Order> findByStateUpdatedBefore(OrderState state, Instant cutoff, int limit);

  List<Order> findOpenSubmittedBefore(Instant cutoff, int limit);

  List<Order> findByStates(Collection<OrderState> states, int limit);

  List<Order> findByState(OrderState state, int offset, int limit);

  long countByState(OrderState state);

  int countChildren(UUID rootOrderId);

  /** Overwrites the state column only; used when recovery re-derives state from transitions. */
  void forceState(UUID orderId, OrderState state, Instant updatedAt);
}
