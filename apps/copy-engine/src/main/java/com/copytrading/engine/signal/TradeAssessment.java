package com.copytrading.engine.signal;

import java.math.BigDecimal;

/** Trade gate outcome; the priced fields are null when the gate rejected before computing them. */
public record TradeAssessment(
    RejectionReason rejection,
    BigDecimal slippage,
    BigDecimal impliedCost,
    BigDecimal winProbability,
    BigDecimal edge) {
  public static TradeAssessment rejected(RejectionReason rejection) {
    return new TradeAssessment(rejection, null, null, null, null);
  }

  public boolean passed() {
    return rejection == null;
  }
}
