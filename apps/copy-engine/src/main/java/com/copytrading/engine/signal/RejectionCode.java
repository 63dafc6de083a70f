package com.copytrading.engine.signal;

public enum RejectionCode {
  WHALE_QUARANTINED,
  MISSING_WHALE_METRICS,
  LOW_WHALE_SCORE,
  DECLINING_SHARPE,
  WHALE_IN_TROUBLE,
  TRADE_TOO_SMALL,
  ORDER_BOOK_UNAVAILABLE,
  INSUFFICIENT_DEPTH,
  SLIPPAGE_TOO_HIGH,
  UNKNOWN_RESOLUTION,
  RESOLUTION_TOO_FAR,
  EDGE_TOO_LOW,
  HIGH_CORRELATION,
  TOTAL_EXPOSURE_LIMIT,
  CATEGORY_EXPOSURE_LIMIT
}
