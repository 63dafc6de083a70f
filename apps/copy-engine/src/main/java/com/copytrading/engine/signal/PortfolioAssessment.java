package com.copytrading.engine.signal;

import java.math.BigDecimal;

public record PortfolioAssessment(RejectionReason rejection, BigDecimal correlation) {
  public boolean passed() {
    return rejection == null;
  }
}
