package com.copytrading.engine.position;

import com.copytrading.domain.positions.CloseReason;

public enum ExitTrigger {
  STOP_LOSS(CloseReason.STOP_LOSS),
  TAKE_PROFIT(CloseReason.TAKE_PROFIT),
  PRE_RESOLUTION(CloseReason.PRE_RESOLUTION),
  WHALE_EXIT(CloseReason.WHALE_EXIT);

  private final CloseReason closeReason;

  ExitTrigger(CloseReason closeReason) {
    this.closeReason = closeReason;
  }

  public CloseReason closeReason() {
    return closeReason;
  }
}
