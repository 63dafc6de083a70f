package com.copytrading.engine.risk;

/** What happens to a whale's open positions when the whale is quarantined. */
public enum QuarantinePolicy {
  HOLD,
  LIQUIDATE
}
