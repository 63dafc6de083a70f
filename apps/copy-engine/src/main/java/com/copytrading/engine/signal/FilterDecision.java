package com.copytrading.engine.signal;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Result of running a signal through the three filter stages. An accepted decision carries the
 * pricing inputs the sizer needs; a rejected one carries only the reason.
 */
public record FilterDecision(
    boolean accepted,
    RejectionReason rejection,
    BigDecimal impliedCost,
    BigDecimal winProbability,
    BigDecimal edge,
    BigDecimal slippage,
    BigDecimal correlation) {
  public static FilterDecision accept(TradeAssessment trade, PortfolioAssessment portfolio) {
    return new FilterDecision(
        true,
        null,
        trade.impliedCost(),
        trade.winProbability(),
        trade.edge(),
        trade.slippage(),
        portfolio.correlation());
  }

  public static FilterDecision reject(RejectionReason rejection) {
    Objects.requireNonNull(rejection, "rejection must not be null");
    return new FilterDecision(false, rejection, null, null, null, null, null);
  }
}
