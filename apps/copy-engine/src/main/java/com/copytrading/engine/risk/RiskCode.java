package com.copytrading.engine.risk;

public enum RiskCode {
  APPROVED,
  TRADING_HALTED,
  TRADING_PAUSED,
  WHALE_QUARANTINED,
  WHALE_DAILY_LOSS_LIMIT,
  POSITION_LIMIT,
  MARKET_EXPOSURE_LIMIT,
  WHALE_EXPOSURE_LIMIT,
  TOTAL_ALLOCATION_LIMIT,
  POSITION_COUNT_LIMIT,
  INVALID_NOTIONAL
}
