package com.copytrading.engine.signal;

import java.math.BigDecimal;

/** Scoring snapshot attached to a whale trade. Any field may be missing. */
public record WhaleMetrics(
    BigDecimal score,
    BigDecimal sharpe30d,
    BigDecimal sharpe90d,
    BigDecimal currentDrawdown,
    BigDecimal winRate) {
  public boolean isComplete() {
    return score != null
        && sharpe30d != null
        && sharpe90d != null
        && currentDrawdown != null
        && winRate != null;
  }
}
