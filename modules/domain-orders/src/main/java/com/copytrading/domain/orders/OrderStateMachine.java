package com.copytrading.domain.orders;

import java.util.EnumSet;
import java.util.Map;

public final class OrderStateMachine {
  private static final Map<OrderState, EnumSet<OrderState>> ALLOWED_TRANSITIONS =
      Map.of(
          OrderState.PENDING,
              EnumSet.of(OrderState.SUBMITTED, OrderState.FAILED, OrderState.CANCELLED),
          OrderState.SUBMITTED,
              EnumSet.of(
                  OrderState.PARTIALLY_FILLED,
                  OrderState.FILLED,
                  OrderState.CANCELLED,
                  OrderState.FAILED),
          OrderState.PARTIALLY_FILLED,
              EnumSet.of(
                  OrderState.PARTIALLY_FILLED,
                  OrderState.FILLED,
                  OrderState.CONFIRMED,
                  OrderState.CANCELLED),
          OrderState.FILLED, EnumSet.of(OrderState.CONFIRMED),
          OrderState.FAILED, EnumSet.of(OrderState.DEAD_LETTER),
          OrderState.CONFIRMED, EnumSet.noneOf(OrderState.class),
          OrderState.CANCELLED, EnumSet.noneOf(OrderState.class),
          OrderState.DEAD_LETTER, EnumSet.noneOf(OrderState.class));

  private OrderStateMachine() {}

  public static boolean canTransition(OrderState from, OrderState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<OrderState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(OrderState from, OrderState to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException("Invalid order state transition from " + from + " to " + to);
    }
  }
}
