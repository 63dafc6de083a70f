package com.copytrading.engine.api;

import com.copytrading.engine.risk.RiskState;
import java.math.BigDecimal;
import java.math.RoundingMode;

public record ExposureResponse(
    BigDecimal totalExposure, BigDecimal nav, BigDecimal utilization, int openPositions) {

  public static ExposureResponse from(RiskState state) {
    BigDecimal nav = state.nav();
    BigDecimal exposure = state.openExposure();
    BigDecimal utilization =
        nav.signum() <= 0 ? BigDecimal.ZERO : exposure.divide(nav, 6, RoundingMode.HALF_UP);
    return new ExposureResponse(exposure, nav, utilization, state.openPositionCount());
  }
}
