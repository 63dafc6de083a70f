package com.copytrading.domain.positions;

public enum CloseReason {
  STOP_LOSS,
  TAKE_PROFIT,
  MANUAL,
  WHALE_EXIT,
  PRE_RESOLUTION;

  public PositionUpdateType terminalUpdateType() {
    return switch (this) {
      case STOP_LOSS -> PositionUpdateType.STOP_LOSS_HIT;
      case TAKE_PROFIT -> PositionUpdateType.TAKE_PROFIT_HIT;
      default -> PositionUpdateType.FULL_CLOSE;
    };
  }
}
