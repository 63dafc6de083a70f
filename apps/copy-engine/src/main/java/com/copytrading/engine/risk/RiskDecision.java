package com.copytrading.engine.risk;

import java.util.Objects;

/** Outcome of a pre-trade check. A veto is a value, not an exception. */
public record RiskDecision(boolean approved, RiskCode code, String reason) {
  public RiskDecision {
    Objects.requireNonNull(code, "code must not be null");
  }

  public static RiskDecision approve() {
    return new RiskDecision(true, RiskCode.APPROVED, "approved");
  }

  public static RiskDecision veto(RiskCode code, String reason) {
    return new RiskDecision(false, code, reason);
  }
}
