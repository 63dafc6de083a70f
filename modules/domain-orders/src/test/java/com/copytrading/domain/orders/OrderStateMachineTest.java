package com.copytrading.domain.orders;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OrderStateMachineTest {
  @Test
  void shouldAllowForwardTransitions() {
    assertTrue(OrderStateMachine.canTransition(OrderState.PENDING, OrderState.SUBMITTED));
    assertTrue(OrderStateMachine.canTransition(OrderState.SUBMITTED, OrderState.FILLED));
    assertTrue(
        OrderStateMachine.canTransition(OrderState.PARTIALLY_FILLED, OrderState.PARTIALLY_FILLED));
    assertTrue(OrderStateMachine.canTransition(OrderState.PARTIALLY_FILLED, OrderState.CONFIRMED));
    assertTrue(OrderStateMachine.canTransition(OrderState.FILLED, OrderState.CONFIRMED));
    assertTrue(OrderStateMachine.canTransition(OrderState.FAILED, OrderState.DEAD_LETTER));
  }

  @Test
  void shouldRejectBackwardOrTerminalTransitions() {
    assertFalse(OrderStateMachine.canTransition(OrderState.SUBMITTED, OrderState.PENDING));
    assertFalse(OrderStateMachine.canTransition(OrderState.FILLED, OrderState.CANCELLED));
    assertFalse(OrderStateMachine.canTransition(OrderState.PENDING, OrderState.DEAD_LETTER));
    for (OrderState terminal :
        new OrderState[] {OrderState.CONFIRMED, OrderState.CANCELLED, OrderState.DEAD_LETTER}) {
      for (OrderState target : OrderState.values()) {
        assertFalse(OrderStateMachine.canTransition(terminal, target), terminal + " -> " + target);
      }
    }
  }

  @Test
  void shouldThrowForInvalidTransition() {
    assertThrows(
        OrderDomainException.class,
        () -> OrderStateMachine.validateTransition(OrderState.CONFIRMED, OrderState.CANCELLED));
  }

  @Test
  void shouldAcceptTransitionValidationForAllowedPath() {
    assertDoesNotThrow(
        () -> OrderStateMachine.validateTransition(OrderState.PENDING, OrderState.SUBMITTED));
  }
}
