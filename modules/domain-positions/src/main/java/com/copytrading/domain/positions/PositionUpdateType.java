package com.copytrading.domain.positions;

public enum PositionUpdateType {
  PRICE_UPDATE,
  SIZE_INCREASE,
  SIZE_DECREASE,
  PARTIAL_CLOSE,
  FULL_CLOSE,
  STOP_LOSS_HIT,
  TAKE_PROFIT_HIT,
  MANUAL_ADJUSTMENT
}
