package com.copytrading.engine.api;

import com.copytrading.engine.risk.RiskDecision;

public record RiskCheckResponse(boolean approved, String code, String reason) {

  public static RiskCheckResponse from(RiskDecision decision) {
    return new RiskCheckResponse(decision.approved(), decision.code().name(), decision.reason());
  }
}
