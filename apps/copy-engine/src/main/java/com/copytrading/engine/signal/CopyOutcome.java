package com.copytrading.engine.signal;

import com.copytrading.domain.orders.Order;

/** What happened to one whale trade. {@code order} is set only when an order was submitted. */
public record CopyOutcome(Status status, String detail, Order order) {
  public enum Status {
    SUBMITTED,
    DUPLICATE,
    REJECTED,
    VETOED,
    TOO_SMALL,
    WHALE_EXIT
  }

  static CopyOutcome of(Status status, String detail) {
    return new CopyOutcome(status, detail, null);
  }
}
