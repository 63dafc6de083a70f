package com.copytrading.engine.api;

import com.copytrading.engine.position.ExitDecision;

public record ExitCandidateResponse(PositionResponse position, String trigger) {

  public static ExitCandidateResponse from(ExitDecision decision) {
    return new ExitCandidateResponse(
        PositionResponse.from(decision.position()), decision.trigger().name());
  }
}
